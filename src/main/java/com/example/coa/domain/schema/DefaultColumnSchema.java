package com.example.coa.domain.schema;

import com.example.coa.domain.model.ColumnDefinition;
import com.example.coa.domain.model.ExtractionPhase;
import com.example.coa.domain.model.ParameterCategory;

import java.util.List;

import static com.example.coa.domain.model.ParameterCategory.CHEMICAL;
import static com.example.coa.domain.model.ParameterCategory.CONTAMINANT;
import static com.example.coa.domain.model.ParameterCategory.GMO;
import static com.example.coa.domain.model.ParameterCategory.IDENTIFIER;
import static com.example.coa.domain.model.ParameterCategory.MICROBIOLOGY;
import static com.example.coa.domain.model.ParameterCategory.NOT_APPLICABLE;
import static com.example.coa.domain.model.ParameterCategory.PHOSPHOLIPID;

/**
 * Built-in column registry mirroring the header row of the COA database workbook.
 * Every column currently belongs to phase 1.
 */
public final class DefaultColumnSchema {

    public static final String SAMPLE_COLUMN = "Sample #";
    public static final String BATCH_COLUMN = "Batch";

    static final String NOFALAB_OR_TLR = "Nofalab or TLR";
    static final String SPECTRAL_SERVICE = "Spectral Service";

    private DefaultColumnSchema() {
    }

    public static ColumnSchema create() {
        return ColumnSchema.builder()
                .add(plain(SAMPLE_COLUMN, "N/A", IDENTIFIER))
                .add(plain(BATCH_COLUMN, "N/A", IDENTIFIER))
                .add(described("AI", NOFALAB_OR_TLR, CHEMICAL, "Acetone Insoluble", "%",
                        "Acetone insoluble matter content", "Acetone insoluble", "Aceton insoluble"))
                .add(described("AV", NOFALAB_OR_TLR, CHEMICAL, "Acid Value", "mg KOH/g",
                        "Acid value measurement", "Acid value"))
                .add(described("POV", NOFALAB_OR_TLR, CHEMICAL, "Peroxide Value", "meq O2/kg",
                        "Peroxide value measurement", "Peroxide value"))
                .add(plain("Color Gardner (As is)", NOFALAB_OR_TLR, CHEMICAL))
                .add(plain("Color Gardner (10% dil.)", NOFALAB_OR_TLR, CHEMICAL))
                .add(plain("Color Iodine", NOFALAB_OR_TLR, CHEMICAL))
                .add(plain("Moisture", NOFALAB_OR_TLR, CHEMICAL))
                .add(plain("Viscosity at 25°C", NOFALAB_OR_TLR, CHEMICAL))
                .add(aliased("Toluene Insolubles", NOFALAB_OR_TLR, CHEMICAL, "Toluene insoluble matter"))
                .add(aliased("Hexane Insolubles", NOFALAB_OR_TLR, CHEMICAL, "Hexane insoluble matter"))
                .add(aliased("Iron (Fe)", NOFALAB_OR_TLR, CHEMICAL, "Iron"))
                .add(described("PC", SPECTRAL_SERVICE, PHOSPHOLIPID, "Phosphatidylcholine", "%",
                        "Phosphatidylcholine content", "Phosphatidylcholine"))
                .add(described("PE", SPECTRAL_SERVICE, PHOSPHOLIPID, "Phosphatidylethanolamine", "%",
                        "Phosphatidylethanolamine content", "Phosphatidylethanolamine"))
                .add(described("LPC", SPECTRAL_SERVICE, PHOSPHOLIPID, "Lysophosphatidylcholine", "%",
                        "Lysophosphatidylcholine content", "Lysophosphatidylcholine"))
                .add(aliased("Total Plate Count", NOFALAB_OR_TLR, MICROBIOLOGY, "Aerobic plate count"))
                .add(plain("Total Viable count", NOFALAB_OR_TLR, MICROBIOLOGY))
                .add(aliased("Yeasts & Molds", NOFALAB_OR_TLR, MICROBIOLOGY, "Yeasts & Moulds", "Yeasts and moulds",
                        "Yeasts and molds"))
                .add(plain("Yeasts", NOFALAB_OR_TLR, MICROBIOLOGY))
                .add(aliased("Moulds", NOFALAB_OR_TLR, MICROBIOLOGY, "Molds"))
                .add(plain("Lypolytic Bacteria", NOFALAB_OR_TLR, MICROBIOLOGY))
                .add(plain("Enterobacteriaceae", NOFALAB_OR_TLR, MICROBIOLOGY))
                .add(plain("Coliforms (in 1g)", NOFALAB_OR_TLR, MICROBIOLOGY))
                .add(aliased("Salmonella (in 25g)", NOFALAB_OR_TLR, MICROBIOLOGY, "Salmonella spp."))
                .add(aliased("PCR, 50 cycl. (GMO), 35S/NOS/FMV", "Alimentaire", GMO, "GMO Screening"))
                .add(aliased("E. coli", NOFALAB_OR_TLR, MICROBIOLOGY, "Escherichia coli"))
                .add(plain("Specific gravity", NOFALAB_OR_TLR, CHEMICAL))
                .add(plain("FFA (%Oleic) at loading", NOFALAB_OR_TLR, CHEMICAL))
                .add(plain("Iodine value", NOFALAB_OR_TLR, CHEMICAL))
                .add(plain("Soap content", NOFALAB_OR_TLR, CHEMICAL))
                .add(plain("Insoluble matters", NOFALAB_OR_TLR, CHEMICAL))
                .add(plain("Moisture and insolubles", NOFALAB_OR_TLR, CHEMICAL))
                .add(plain("Sum PCB28, PCB52, PCB101, PCB138,PCB153 and PCB180", NOFALAB_OR_TLR, CONTAMINANT))
                .add(plain("Sum Dioxins (WHO-PCDD/F-TEQ)", NOFALAB_OR_TLR, CONTAMINANT))
                .add(plain("Sum Dioxins and Dioxin Like PCB's (WHOPCDD/F-PCBTEQ)", NOFALAB_OR_TLR, CONTAMINANT))
                .add(aliased("Lead", NOFALAB_OR_TLR, CONTAMINANT, "Lead (Pb)"))
                .add(aliased("Arsenic", NOFALAB_OR_TLR, CONTAMINANT, "Arsenic (As)"))
                .add(described("PA", SPECTRAL_SERVICE, PHOSPHOLIPID, "Phosphatidic Acid", "%",
                        "Phosphatidic acid content", "Phosphatidic acid"))
                .add(described("PI", SPECTRAL_SERVICE, PHOSPHOLIPID, "Phosphatidylinositol", "%",
                        "Phosphatidylinositol content", "Phosphatidylinositol"))
                .add(described("P", SPECTRAL_SERVICE, PHOSPHOLIPID, "Phosphorus", "%",
                        "Total phosphorus content", "Phosphorus"))
                .add(described("PL", SPECTRAL_SERVICE, PHOSPHOLIPID, "Phospholipids", "%",
                        "Total phospholipids content", "Phospholipids", "Total phospholipids"))
                .add(aliased("Mercury", NOFALAB_OR_TLR, CONTAMINANT, "Mercury (Hg)"))
                .add(plain("FA", "N.a.", NOT_APPLICABLE))
                .add(plain("Listeria monocytogenes (in 25g)", NOFALAB_OR_TLR, MICROBIOLOGY))
                .add(plain("Coag.-Pos. staphylococci", NOFALAB_OR_TLR, MICROBIOLOGY))
                .add(aliased("Pesticides", NOFALAB_OR_TLR, CONTAMINANT, "Pesticide residues"))
                .add(plain("Heavy Metals", NOFALAB_OR_TLR, CONTAMINANT))
                .add(aliased("PAH4", NOFALAB_OR_TLR, CONTAMINANT, "Sum of PAH-4", "PAH-4"))
                .add(plain("Ochratoxin A", NOFALAB_OR_TLR, CONTAMINANT))
                .add(plain("Peanut content", "IFP", CONTAMINANT))
                .add(plain("Salmonella (in 250g)", NOFALAB_OR_TLR, MICROBIOLOGY))
                .add(plain("Hydrolysis Degree (LPC/(LPC+PC) in mol%)", SPECTRAL_SERVICE, PHOSPHOLIPID))
                .add(plain("Bacillus cereus", NOFALAB_OR_TLR, MICROBIOLOGY))
                .add(plain("MOH (MOSH/MOAH)", NOFALAB_OR_TLR, CONTAMINANT))
                .add(plain("Soy Allergen", "IFP", CONTAMINANT))
                .add(plain("Cronobacter spp.", NOFALAB_OR_TLR, MICROBIOLOGY))
                .build();
    }

    private static ColumnDefinition plain(String name, String laboratory, ParameterCategory category) {
        return ColumnDefinition.of(name, laboratory, category, ExtractionPhase.PHASE_1);
    }

    private static ColumnDefinition aliased(String name, String laboratory, ParameterCategory category, String... aliases) {
        return new ColumnDefinition(name, laboratory, category, ExtractionPhase.PHASE_1, false,
                null, null, null, List.of(aliases));
    }

    private static ColumnDefinition described(String name, String laboratory, ParameterCategory category,
                                              String fullName, String unit, String definition, String... aliases) {
        return new ColumnDefinition(name, laboratory, category, ExtractionPhase.PHASE_1, false,
                fullName, unit, definition, List.of(aliases));
    }
}

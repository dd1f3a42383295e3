package com.example.coa.infrastructure.pdf;

import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.TextPosition;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Collects every word of the stripped page range as a positioned token, grouped into lines by baseline.
 */
final class PositionalLineStripper extends PDFTextStripper {
    private static final float Y_TOLERANCE = 1.5f;
    private final List<TableLine> lines = new ArrayList<>();

    PositionalLineStripper() {
        setSortByPosition(true);
        setSuppressDuplicateOverlappingText(false);
    }

    List<TableLine> getLines() {
        lines.sort(Comparator.comparing(TableLine::y));
        return new ArrayList<>(lines);
    }

    @Override
    protected void writeString(String text, List<TextPosition> textPositions) throws IOException {
        if (!textPositions.isEmpty()) {
            StringBuilder builder = new StringBuilder();
            for (TextPosition position : textPositions) {
                builder.append(position.getUnicode());
            }
            String tokenText = builder.toString();
            if (!tokenText.isBlank()) {
                float tokenX = textPositions.stream()
                        .map(TextPosition::getXDirAdj)
                        .min(Float::compareTo)
                        .orElse(0f);
                TextPosition last = textPositions.get(textPositions.size() - 1);
                float tokenEnd = Math.max(last.getXDirAdj() + last.getWidthDirAdj(), tokenX + 0.5f);
                float tokenY = textPositions.stream()
                        .map(TextPosition::getYDirAdj)
                        .min(Float::compareTo)
                        .orElse(0f);
                resolveLine(tokenY).addToken(new PositionedToken(tokenX, tokenEnd, tokenText));
            }
        }
        super.writeString(text, textPositions);
    }

    private TableLine resolveLine(float y) {
        for (TableLine line : lines) {
            if (Math.abs(line.y() - y) < Y_TOLERANCE) {
                return line;
            }
        }
        TableLine line = new TableLine(y);
        lines.add(line);
        return line;
    }
}

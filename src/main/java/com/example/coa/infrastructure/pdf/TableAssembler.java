package com.example.coa.infrastructure.pdf;

import com.example.coa.domain.model.ParsedTable;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Rebuilds tables from positioned lines of one page.
 * <p>
 * A line with two or more cells opens a table and fixes its column anchors. Following lines become rows while
 * their cells stay inside the anchored columns. A line without a label cell continues the previous row, which is
 * how packed multi-value cells come out of the exporters: every extra value sits on its own baseline. A line whose
 * cells do not fit the anchors one to one closes the table and may open the next one, so a two-part letterhead
 * above the results does not swallow the real header.
 */
final class TableAssembler {

    static final float CELL_GAP = 8f;
    static final float MAX_ROW_GAP = 40f;
    private static final float LEFT_SLACK = 6f;

    private TableAssembler() {
    }

    static List<ParsedTable> assemble(int pageNumber, List<TableLine> lines) {
        List<ParsedTable> tables = new ArrayList<>();
        TableBuilder current = null;
        for (TableLine line : lines) {
            List<PositionedToken> cells = line.cells(CELL_GAP);
            if (cells.isEmpty()) {
                continue;
            }
            if (current != null && !current.accepts(line, cells)) {
                current.build(pageNumber).ifPresent(tables::add);
                current = null;
            }
            if (current == null) {
                if (cells.size() >= 2) {
                    current = new TableBuilder(cells, line.y());
                }
                continue;
            }
            current.add(line, cells);
        }
        if (current != null) {
            current.build(pageNumber).ifPresent(tables::add);
        }
        return tables;
    }

    private static final class TableBuilder {
        private final List<Float> anchors = new ArrayList<>();
        private final List<List<StringBuilder>> rows = new ArrayList<>();
        private float lastY;

        TableBuilder(List<PositionedToken> header, float y) {
            List<StringBuilder> headerRow = new ArrayList<>();
            for (PositionedToken cell : header) {
                anchors.add(cell.x());
                headerRow.add(new StringBuilder(cell.text()));
            }
            rows.add(headerRow);
            lastY = y;
        }

		/**
		 * A line belongs to the table when it is close enough and each of its cells lands in a column of its own.
		 * Two cells sharing an anchor mean the anchors came from a line that is not the table header.
		 */
        boolean accepts(TableLine line, List<PositionedToken> cells) {
            if (line.y() - lastY > MAX_ROW_GAP || cells.size() > anchors.size()) {
                return false;
            }
            Set<Integer> columns = new HashSet<>();
            for (PositionedToken cell : cells) {
                int column = locate(cell);
                if (column < 0 || !columns.add(column)) {
                    return false;
                }
            }
            return true;
        }

        void add(TableLine line, List<PositionedToken> cells) {
            boolean continuation = rows.size() > 1 && cells.stream().noneMatch(cell -> locate(cell) == 0);
            List<StringBuilder> target = continuation ? rows.get(rows.size() - 1) : newRow();
            for (PositionedToken cell : cells) {
                StringBuilder builder = target.get(locate(cell));
                if (builder.length() > 0) {
                    builder.append(continuation ? '\n' : ' ');
                }
                builder.append(cell.text());
            }
            lastY = line.y();
        }

        private List<StringBuilder> newRow() {
            List<StringBuilder> row = new ArrayList<>();
            for (int i = 0; i < anchors.size(); i++) {
                row.add(new StringBuilder());
            }
            rows.add(row);
            return row;
        }

		/**
		 * @return column whose span holds the cell's centre, or -1 when the cell starts left of the table
		 */
        private int locate(PositionedToken cell) {
            if (cell.x() < anchors.get(0) - LEFT_SLACK) {
                return -1;
            }
            float center = cell.center();
            for (int i = anchors.size() - 1; i > 0; i--) {
                if (center >= anchors.get(i) - LEFT_SLACK) {
                    return i;
                }
            }
            return 0;
        }

        Optional<ParsedTable> build(int pageNumber) {
            if (rows.size() < 2) {
                return Optional.empty();
            }
            List<List<String>> cells = new ArrayList<>();
            for (List<StringBuilder> row : rows) {
                cells.add(row.stream().map(StringBuilder::toString).toList());
            }
            return Optional.of(new ParsedTable(pageNumber, cells));
        }
    }
}

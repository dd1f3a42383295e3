package com.example.coa.infrastructure.pdf;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Tokens sharing one baseline, ordered left to right.
 */
final class TableLine {
    private final float y;
    private final List<PositionedToken> tokens = new ArrayList<>();
    private boolean sorted = false;

    TableLine(float y) {
        this.y = y;
    }

    void addToken(PositionedToken token) {
        if (token == null || token.text().isBlank()) {
            return;
        }
        tokens.add(token);
        sorted = false;
    }

    List<PositionedToken> tokens() {
        if (!sorted) {
            tokens.sort(Comparator.comparing(PositionedToken::x));
            sorted = true;
        }
        return tokens;
    }

    float y() {
        return y;
    }

	/**
	 * Merges neighbouring tokens into cells; a horizontal gap wider than {@code cellGap} starts a new cell.
	 */
    List<PositionedToken> cells(float cellGap) {
        List<PositionedToken> cells = new ArrayList<>();
        PositionedToken current = null;
        for (PositionedToken token : tokens()) {
            PositionedToken trimmed = new PositionedToken(token.x(), token.endX(), token.text().trim());
            if (current == null) {
                current = trimmed;
            } else if (trimmed.x() - current.endX() > cellGap) {
                cells.add(current);
                current = trimmed;
            } else {
                current = current.merge(trimmed);
            }
        }
        if (current != null) {
            cells.add(current);
        }
        return cells;
    }

    String text() {
        return tokens().stream()
                .map(PositionedToken::text)
                .map(String::trim)
                .filter(value -> !value.isEmpty())
                .collect(Collectors.joining(" "));
    }
}

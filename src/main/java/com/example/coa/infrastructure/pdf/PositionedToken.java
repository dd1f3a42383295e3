package com.example.coa.infrastructure.pdf;

/**
 * Word or merged cell text with its horizontal extent on the page.
 */
final class PositionedToken {
    private final float x;
    private final float endX;
    private final String text;

    PositionedToken(float x, float endX, String text) {
        this.x = x;
        this.endX = Math.max(endX, x);
        this.text = text == null ? "" : text;
    }

    float x() {
        return x;
    }

    float endX() {
        return endX;
    }

    float center() {
        return x + ((endX - x) / 2f);
    }

    String text() {
        return text;
    }

    PositionedToken merge(PositionedToken next) {
        return new PositionedToken(Math.min(x, next.x), Math.max(endX, next.endX), text + " " + next.text);
    }
}

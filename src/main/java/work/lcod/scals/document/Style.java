package work.lcod.scals.document;

import work.lcod.scals.ir.Dimension;
import work.lcod.scals.ir.FontWeight;
import work.lcod.scals.ir.TextAlignment;

/**
 * Named bag of presentation properties. {@code inherits} names the single parent style.
 * A {@code null} field is "not specified" and inherits.
 */
public record Style(
    String inherits,
    String fontFamily,
    Double fontSize,
    FontWeight fontWeight,
    String textColor,
    TextAlignment textAlignment,
    String backgroundColor,
    Double cornerRadius,
    Double borderWidth,
    String borderColor,
    ShadowSpec shadow,
    String tintColor,
    Dimension width,
    Dimension height,
    Dimension minWidth,
    Dimension minHeight,
    Dimension maxWidth,
    Dimension maxHeight,
    Padding padding
) {
    public static final Style EMPTY = builder().build();

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String inherits;
        private String fontFamily;
        private Double fontSize;
        private FontWeight fontWeight;
        private String textColor;
        private TextAlignment textAlignment;
        private String backgroundColor;
        private Double cornerRadius;
        private Double borderWidth;
        private String borderColor;
        private ShadowSpec shadow;
        private String tintColor;
        private Dimension width;
        private Dimension height;
        private Dimension minWidth;
        private Dimension minHeight;
        private Dimension maxWidth;
        private Dimension maxHeight;
        private Padding padding;

        public Builder inherits(String inherits) {
            this.inherits = inherits;
            return this;
        }

        public Builder fontFamily(String fontFamily) {
            this.fontFamily = fontFamily;
            return this;
        }

        public Builder fontSize(Double fontSize) {
            this.fontSize = fontSize;
            return this;
        }

        public Builder fontWeight(FontWeight fontWeight) {
            this.fontWeight = fontWeight;
            return this;
        }

        public Builder textColor(String textColor) {
            this.textColor = textColor;
            return this;
        }

        public Builder textAlignment(TextAlignment textAlignment) {
            this.textAlignment = textAlignment;
            return this;
        }

        public Builder backgroundColor(String backgroundColor) {
            this.backgroundColor = backgroundColor;
            return this;
        }

        public Builder cornerRadius(Double cornerRadius) {
            this.cornerRadius = cornerRadius;
            return this;
        }

        public Builder borderWidth(Double borderWidth) {
            this.borderWidth = borderWidth;
            return this;
        }

        public Builder borderColor(String borderColor) {
            this.borderColor = borderColor;
            return this;
        }

        public Builder shadow(ShadowSpec shadow) {
            this.shadow = shadow;
            return this;
        }

        public Builder tintColor(String tintColor) {
            this.tintColor = tintColor;
            return this;
        }

        public Builder width(Dimension width) {
            this.width = width;
            return this;
        }

        public Builder height(Dimension height) {
            this.height = height;
            return this;
        }

        public Builder minWidth(Dimension minWidth) {
            this.minWidth = minWidth;
            return this;
        }

        public Builder minHeight(Dimension minHeight) {
            this.minHeight = minHeight;
            return this;
        }

        public Builder maxWidth(Dimension maxWidth) {
            this.maxWidth = maxWidth;
            return this;
        }

        public Builder maxHeight(Dimension maxHeight) {
            this.maxHeight = maxHeight;
            return this;
        }

        public Builder padding(Padding padding) {
            this.padding = padding;
            return this;
        }

        public Style build() {
            return new Style(
                inherits,
                fontFamily,
                fontSize,
                fontWeight,
                textColor,
                textAlignment,
                backgroundColor,
                cornerRadius,
                borderWidth,
                borderColor,
                shadow,
                tintColor,
                width,
                height,
                minWidth,
                minHeight,
                maxWidth,
                maxHeight,
                padding
            );
        }
    }
}

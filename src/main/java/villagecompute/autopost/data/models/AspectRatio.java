package villagecompute.autopost.data.models;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import villagecompute.autopost.exceptions.ValidationException;

/**
 * Supported image aspect ratios and the pixel size requested from the image API for each.
 *
 * <p>
 * Stored by label ({@code "3:4"}) rather than enum name so rows stay readable in SQL.
 */
public enum AspectRatio {

    SQUARE("1:1", "2048x2048"),
    LANDSCAPE_4_3("4:3", "2304x1728"),
    PORTRAIT_3_4("3:4", "1728x2304"),
    WIDE_16_9("16:9", "2560x1440"),
    TALL_9_16("9:16", "1440x2560"),
    LANDSCAPE_3_2("3:2", "2496x1664"),
    PORTRAIT_2_3("2:3", "1664x2496"),
    ULTRAWIDE_21_9("21:9", "3024x1296");

    public static final AspectRatio DEFAULT = PORTRAIT_3_4;

    private final String label;
    private final String size;

    AspectRatio(String label, String size) {
        this.label = label;
        this.size = size;
    }

    public String getLabel() {
        return label;
    }

    /**
     * @return {@code WIDTHxHEIGHT} as sent in the image API {@code size} field
     */
    public String getSize() {
        return size;
    }

    /**
     * Parses a ratio label. A null or blank label yields {@link #DEFAULT}.
     *
     * @param label
     *            ratio such as {@code "16:9"}
     * @return matching ratio
     * @throws ValidationException
     *             if the label is not a supported ratio
     */
    public static AspectRatio fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return DEFAULT;
        }
        for (AspectRatio ratio : values()) {
            if (ratio.label.equals(label.trim())) {
                return ratio;
            }
        }
        throw new ValidationException("Unsupported aspect ratio: " + label);
    }

    /**
     * JPA converter storing the ratio label.
     */
    @Converter(
            autoApply = true)
    public static class LabelConverter implements AttributeConverter<AspectRatio, String> {

        @Override
        public String convertToDatabaseColumn(AspectRatio attribute) {
            return attribute == null ? null : attribute.label;
        }

        @Override
        public AspectRatio convertToEntityAttribute(String dbData) {
            return fromLabel(dbData);
        }
    }
}

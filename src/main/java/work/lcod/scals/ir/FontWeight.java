package work.lcod.scals.ir;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

public enum FontWeight {
    ULTRA_LIGHT("ultraLight"),
    THIN("thin"),
    LIGHT("light"),
    REGULAR("regular"),
    MEDIUM("medium"),
    SEMIBOLD("semibold"),
    BOLD("bold"),
    HEAVY("heavy"),
    BLACK("black");

    private final String wireName;

    FontWeight(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /** Returns {@code null} for unknown names. */
    public static FontWeight fromWireName(String name) {
        for (var weight : values()) {
            if (weight.wireName.equals(name)) {
                return weight;
            }
        }
        return null;
    }

    public static List<String> wireNames() {
        return Arrays.stream(values()).map(FontWeight::wireName).collect(Collectors.toList());
    }
}

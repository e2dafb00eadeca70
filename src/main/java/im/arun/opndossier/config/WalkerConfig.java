package im.arun.opndossier.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;

@Data
public class WalkerConfig {
    /** Markdown has six heading levels; deeper values are clamped. */
    public static final int MAX_HEADING_LEVEL = 6;

    private int maxDepth = MAX_HEADING_LEVEL;
    private String rootTitle = "OPNsense Configuration";
    private String markerText = "enabled";
    private String identityField = "XMLName";

    /**
     * Depth ceiling actually applied by the walker, always within 1..6.
     */
    @JsonIgnore
    public int effectiveMaxDepth() {
        return Math.max(1, Math.min(maxDepth, MAX_HEADING_LEVEL));
    }
}

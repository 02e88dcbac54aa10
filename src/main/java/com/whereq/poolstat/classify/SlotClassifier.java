package com.whereq.poolstat.classify;

import com.whereq.poolstat.model.Attributes;
import com.whereq.poolstat.model.SlotClassification;
import com.whereq.poolstat.model.SlotClassification.Category;
import com.whereq.poolstat.model.StateRecord;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps a slot record to its type, state and, when claimed, the occupying group and owner
 */
public class SlotClassifier {

    public static final String DEFAULT_SLOT_TYPE = "Static";
    public static final String GLIDEIN_SUFFIX = "Glidein";
    public static final String UNKNOWN = "Unknown";
    public static final String CLAIMED = "Claimed";
    public static final String PARTITIONABLE = "Partitionable";

    private static final Pattern GROUP_OWNER = Pattern.compile("group_(\\S+)\\.(\\S+)@\\S+$");
    private static final String NO_GROUP = "<none>";

    public SlotClassification classify(StateRecord slot) {
        String slotType = slot.string(Attributes.SLOT_TYPE, DEFAULT_SLOT_TYPE);
        if (slot.bool(Attributes.IS_GLIDEIN).orElse(false)) {
            slotType += GLIDEIN_SUFFIX;
        }
        String state = slot.string(Attributes.STATE, UNKNOWN);

        SlotClassification.SlotClassificationBuilder result = SlotClassification.builder()
            .slotType(slotType)
            .state(state);

        if (PARTITIONABLE.equals(slotType) || (PARTITIONABLE + GLIDEIN_SUFFIX).equals(slotType)) {
            return result.category(Category.PARTITIONABLE).build();
        }
        if (!CLAIMED.equals(state)) {
            return result.category(Category.OTHER).build();
        }

        String group = UNKNOWN;
        String owner = UNKNOWN;
        Optional<Matcher> accounting = slot.string(Attributes.ACCOUNTING_GROUP)
            .map(GROUP_OWNER::matcher)
            .filter(Matcher::matches);
        if (accounting.isPresent()) {
            group = accounting.get().group(1);
            owner = accounting.get().group(2);
        }
        if (UNKNOWN.equals(group)) {
            group = slot.string(Attributes.REMOTE_GROUP)
                .map(remote -> NO_GROUP.equals(remote) ? "None" : remote)
                .orElse(UNKNOWN);
        }
        if (UNKNOWN.equals(owner)) {
            owner = slot.string(Attributes.REMOTE_OWNER)
                .map(remote -> remote.split("@", 2)[0])
                .orElse(UNKNOWN);
        }

        return result.category(Category.CLAIMED)
            .group(sanitize(group))
            .owner(sanitize(owner))
            .build();
    }

    /**
     * Make a free-text identifier safe inside a dotted metric path
     */
    public static String sanitize(String key) {
        if (key == null) {
            return null;
        }
        return key.replace(".", "_").replace("@", "-").replace(" ", "_");
    }
}

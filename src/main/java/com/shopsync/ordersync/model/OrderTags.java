package com.shopsync.ordersync.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Flags parsed out of an order's free-text tag field. A flag is raised when any tag token
 * contains one of its spellings, ignoring case, so "WhatsApp Confirmed" also raises
 * {@link TagFlag#CONFIRMED}.
 */
public final class OrderTags {

    private static final Pattern DELIMITER = Pattern.compile("[,;|]");

    private final List<String> tokens;
    private final Set<TagFlag> flags;

    private OrderTags(List<String> tokens, Set<TagFlag> flags) {
        this.tokens = tokens;
        this.flags = flags;
    }

    public static OrderTags parse(String rawTags, Map<TagFlag, List<String>> vocabulary) {
        List<String> tokens = new ArrayList<>();
        if (rawTags != null) {
            for (String part : DELIMITER.split(rawTags)) {
                String token = part.trim();
                if (!token.isEmpty()) {
                    tokens.add(token);
                }
            }
        }

        EnumSet<TagFlag> flags = EnumSet.noneOf(TagFlag.class);
        for (String token : tokens) {
            String lower = token.toLowerCase(Locale.ROOT);
            for (TagFlag flag : TagFlag.values()) {
                List<String> spellings = vocabulary.getOrDefault(flag, flag.defaultSpellings());
                for (String spelling : spellings) {
                    if (spelling != null && !spelling.isBlank()
                            && lower.contains(spelling.trim().toLowerCase(Locale.ROOT))) {
                        flags.add(flag);
                        break;
                    }
                }
            }
        }
        return new OrderTags(Collections.unmodifiableList(tokens), Collections.unmodifiableSet(flags));
    }

    public boolean has(TagFlag flag) {
        return flags.contains(flag);
    }

    public boolean hasAny(TagFlag first, TagFlag second) {
        return flags.contains(first) || flags.contains(second);
    }

    public List<String> tokens() {
        return tokens;
    }

    public Set<TagFlag> flags() {
        return flags;
    }

    @Override
    public String toString() {
        return "OrderTags" + flags;
    }
}

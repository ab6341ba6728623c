package com.shopsync.ordersync.config;

import com.shopsync.ordersync.model.OrderTags;
import com.shopsync.ordersync.model.TagFlag;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Single source of the tag spellings the scenario rules look for. Configured spellings are
 * added to the defaults, never replace them.
 */
@ConfigurationProperties(prefix = "app.tags")
public class TagVocabulary {

    private Map<TagFlag, List<String>> synonyms = new EnumMap<>(TagFlag.class);

    public Map<TagFlag, List<String>> getSynonyms() {
        return synonyms;
    }

    public void setSynonyms(Map<TagFlag, List<String>> synonyms) {
        this.synonyms = synonyms == null ? new EnumMap<>(TagFlag.class) : new EnumMap<>(synonyms);
    }

    public Map<TagFlag, List<String>> spellings() {
        Map<TagFlag, List<String>> merged = new EnumMap<>(TagFlag.class);
        for (TagFlag flag : TagFlag.values()) {
            Set<String> all = new LinkedHashSet<>(flag.defaultSpellings());
            List<String> extra = synonyms.get(flag);
            if (extra != null) {
                for (String spelling : extra) {
                    if (spelling != null && !spelling.isBlank()) {
                        all.add(spelling.trim());
                    }
                }
            }
            merged.put(flag, Collections.unmodifiableList(new ArrayList<>(all)));
        }
        return merged;
    }

    public OrderTags parse(String rawTags) {
        return OrderTags.parse(rawTags, spellings());
    }
}

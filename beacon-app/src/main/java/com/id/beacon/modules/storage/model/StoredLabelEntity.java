package com.id.beacon.modules.storage.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Label or attribute pair. Stored as a list of pairs rather than a sub-document because keys such as
 * {@code service.name} contain dots.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class StoredLabelEntity {

    private String name;
    private String value;

    public static List<StoredLabelEntity> fromMap(Map<String, String> map) {
        List<StoredLabelEntity> result = new ArrayList<>();
        if (map != null) {
            map.forEach((k, v) -> result.add(new StoredLabelEntity(k, v)));
        }
        return result;
    }

    public static Map<String, String> toMap(List<StoredLabelEntity> labels) {
        Map<String, String> result = new LinkedHashMap<>();
        if (labels != null) {
            labels.forEach(l -> result.put(l.getName(), l.getValue()));
        }
        return result;
    }
}

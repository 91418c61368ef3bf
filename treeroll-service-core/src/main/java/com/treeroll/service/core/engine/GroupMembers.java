package com.treeroll.service.core.engine;

import java.util.List;

public record GroupMembers<K, T>(K key, List<T> members) {

    public GroupMembers {
        members = members == null ? List.of() : List.copyOf(members);
    }
}

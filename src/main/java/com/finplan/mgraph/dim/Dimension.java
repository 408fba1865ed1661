package com.finplan.mgraph.dim;

import com.finplan.mgraph.error.ConfigurationException;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * A named categorical axis with ordered members (e.g. geography = [US, EU]).
 * Immutable; member order defines the axis index of each member.
 */
public final class Dimension {
    private final String name;
    private final List<String> members;
    private final Map<String, Integer> memberToIndex;

    public Dimension(String name, List<String> members) {
        if (name == null || name.isBlank())
            throw new ConfigurationException("Dimension name must not be blank");
        this.name = name;
        this.members = List.copyOf(members);
        this.memberToIndex = new HashMap<>(members.size() * 2);
        for (int i = 0; i < this.members.size(); i++) {
            if (memberToIndex.put(this.members.get(i), i) != null)
                throw new ConfigurationException(
                        "Duplicate member '" + this.members.get(i) + "' in dimension " + name);
        }
    }

    public String name() {
        return name;
    }

    public List<String> members() {
        return members;
    }

    public int size() {
        return members.size();
    }

    /** Returns the axis index of a member, or -1 when it is not a member. */
    public int indexOf(String member) {
        Integer idx = memberToIndex.get(member);
        return idx == null ? -1 : idx;
    }

    public String member(int index) {
        return members.get(index);
    }

    @Override
    public String toString() {
        return name + members;
    }
}

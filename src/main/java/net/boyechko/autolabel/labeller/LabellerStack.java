/*
 * AutoLabel - Counter-based labelling for document trees
 * Copyright (C) 2025 Richard Boyechko
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published
 * by the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package net.boyechko.autolabel.labeller;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.boyechko.autolabel.template.ScopeSelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The labellers currently in scope during a walk.
 *
 * <p>Headings occupy one slot per level. List labellers are pushed and popped with their lists.
 * Standalone series (figures, tables) are kept per element type, outside the parent search.
 * Removing or advancing a labeller retires every labeller built on it, recursively.
 */
public class LabellerStack {
    private static final Logger logger = LoggerFactory.getLogger(LabellerStack.class);

    private final List<Labeller> active = new ArrayList<>();
    private final Labeller[] headings = new Labeller[7];
    private final Map<String, Labeller> series = new LinkedHashMap<>();

    public Labeller heading(int level) {
        return level >= 1 && level <= 6 ? headings[level] : null;
    }

    public void pushHeading(int level, Labeller labeller) {
        if (headings[level] != null) {
            evict(headings[level]);
        }
        headings[level] = labeller;
        active.add(labeller);
    }

    /** Retires the headings at levels deeper than {@code level}. */
    public void closeHeadingsBelow(int level) {
        for (int l = 6; l > level; l--) {
            if (headings[l] != null) {
                evict(headings[l]);
            }
        }
    }

    public void push(Labeller labeller) {
        active.add(labeller);
    }

    /** Retires a labeller and its dependents. */
    public void remove(Labeller labeller) {
        evict(labeller);
    }

    /** Puts {@code replacement} in the place of {@code old} and retires {@code old}. */
    public void replace(Labeller old, Labeller replacement) {
        int index = indexOf(old);
        if (index >= 0) {
            active.add(index + 1, replacement);
        } else {
            active.add(replacement);
        }
        for (int l = 1; l <= 6; l++) {
            if (headings[l] == old) {
                headings[l] = replacement;
            }
        }
        series.replaceAll((type, s) -> s == old ? replacement : s);
        evict(old);
    }

    public Labeller series(String elementType) {
        return series.get(elementType);
    }

    public void putSeries(String elementType, Labeller labeller) {
        Labeller old = series.put(elementType, labeller);
        if (old != null && old != labeller) {
            evictDependents(old);
        }
    }

    /** Counts one more labelled element and retires the labellers built on the old count. */
    public void advance(Labeller labeller) {
        labeller.increment();
        evictDependents(labeller);
    }

    /** Returns the innermost active labeller of exactly this element type, or null. */
    public Labeller findNearest(String elementType) {
        for (int i = active.size() - 1; i >= 0; i--) {
            if (active.get(i).elementType().equals(elementType)) {
                return active.get(i);
            }
        }
        return null;
    }

    public boolean hasActive(String elementType) {
        return findNearest(elementType) != null;
    }

    /** Returns the innermost numbered labeller matching {@code selector}, or null. */
    public Labeller findParent(ScopeSelector selector) {
        if (selector == null) {
            return null;
        }
        for (int i = active.size() - 1; i >= 0; i--) {
            Labeller l = active.get(i);
            if (l.isNumbered() && selector.matchesType(l.elementType())) {
                return l;
            }
        }
        return null;
    }

    /** Finds the labeller a reference selector points to: active scopes first, then series. */
    public Labeller findForReference(ScopeSelector selector) {
        Labeller found = findParent(selector);
        if (found != null) {
            return found;
        }
        for (Labeller s : series.values()) {
            if (s.isNumbered() && selector.matchesType(s.elementType())) {
                return s;
            }
        }
        return null;
    }

    public List<Labeller> active() {
        return List.copyOf(active);
    }

    private int indexOf(Labeller labeller) {
        for (int i = 0; i < active.size(); i++) {
            if (active.get(i) == labeller) return i;
        }
        return -1;
    }

    private void evict(Labeller labeller) {
        int index = indexOf(labeller);
        if (index >= 0) {
            active.remove(index);
        }
        for (int l = 1; l <= 6; l++) {
            if (headings[l] == labeller) {
                headings[l] = null;
            }
        }
        series.values().removeIf(s -> s == labeller);
        evictDependents(labeller);
        logger.debug("Retired {}", labeller);
    }

    private void evictDependents(Labeller labeller) {
        for (Labeller dependent : new ArrayList<>(labeller.dependents())) {
            evict(dependent);
        }
        labeller.clearDependents();
    }
}

package org.sasslite.symbols;

import org.eclipse.collections.api.factory.Lists;
import org.eclipse.collections.api.factory.Maps;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.sasslite.dsl.SassSyntaxException;
import org.sasslite.dsl.SourceLine;

import java.util.List;
import java.util.Set;

/**
 * Mixins defined so far in a compilation.
 *
 * A mixin body is kept as the raw nested lines of its definition. Each
 * inclusion builds those lines again, so constants inside the body take the
 * values they have at the inclusion site.
 */
public final class MixinTable {

    private final MutableMap<String, ImmutableList<SourceLine>> bodies;

    private MixinTable(MutableMap<String, ImmutableList<SourceLine>> bodies) {
        this.bodies = bodies;
    }

    public static MixinTable empty() {
        return new MixinTable(Maps.mutable.empty());
    }

    public void define(String name, List<SourceLine> body) {
        bodies.put(name, Lists.immutable.withAll(body));
    }

    public boolean isDefined(String name) {
        return bodies.containsKey(name);
    }

    /**
     * Looks up the body of a mixin for inclusion.
     *
     * @param name The mixin name without the leading {@code +}
     * @param line The line of the inclusion, for error reporting
     * @return The unbuilt body lines
     * @throws SassSyntaxException if no mixin with that name was defined
     */
    public List<SourceLine> include(String name, int line) {
        ImmutableList<SourceLine> body = bodies.get(name);
        if (body == null) {
            throw new SassSyntaxException("Undefined mixin '" + name + "'.", line);
        }
        return body.castToList();
    }

    public void putAll(MixinTable other) {
        bodies.putAll(other.bodies);
    }

    public MixinTable copy() {
        MutableMap<String, ImmutableList<SourceLine>> copied = Maps.mutable.empty();
        copied.putAll(bodies);
        return new MixinTable(copied);
    }

    public Set<String> names() {
        return Set.copyOf(bodies.keySet());
    }

    @Override
    public String toString() {
        return "Mixins" + bodies.keySet();
    }
}

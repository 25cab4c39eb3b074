package eu.fbk.ontomodule.extract;

import java.io.Serializable;
import java.util.Arrays;
import java.util.Set;

import javax.annotation.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.common.collect.Sets;

/**
 * A term selected by the user for inclusion in a module.
 * <p>
 * A seed carries its identifier (or label, before resolution), an optional parent that replaces
 * the parents computed from the hierarchy, and the set of {@link Related} directives telling
 * which neighbouring terms should be included as well.
 * </p>
 */
public final class SeedTerm implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String id;

    @Nullable
    private final String overrideParent;

    private final Set<Related> related;

    private SeedTerm(final String id, @Nullable final String overrideParent,
            final Set<Related> related) {
        Preconditions.checkArgument(!id.trim().isEmpty(), "Empty seed identifier");
        this.id = id;
        this.overrideParent = overrideParent == null || overrideParent.trim().isEmpty() ? null
                : overrideParent.trim();
        this.related = Sets.immutableEnumSet(related);
    }

    public static SeedTerm create(final String id, @Nullable final String overrideParent,
            final Iterable<Related> related) {
        return new SeedTerm(Preconditions.checkNotNull(id), overrideParent,
                Sets.newEnumSet(related, Related.class));
    }

    public static SeedTerm create(final String id, final Related... related) {
        return create(id, null, Arrays.asList(related));
    }

    public String getId() {
        return this.id;
    }

    @Nullable
    public String getOverrideParent() {
        return this.overrideParent;
    }

    public Set<Related> getRelated() {
        return this.related;
    }

    /**
     * Returns a copy of this seed with a different identifier and override parent, as obtained
     * by resolving them against a store.
     *
     * @param id
     *            the new identifier
     * @param overrideParent
     *            the new override parent, possibly null
     * @return the resolved seed
     */
    public SeedTerm withId(final String id, @Nullable final String overrideParent) {
        return new SeedTerm(Preconditions.checkNotNull(id), overrideParent, this.related);
    }

    @Override
    public boolean equals(final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof SeedTerm)) {
            return false;
        }
        final SeedTerm other = (SeedTerm) object;
        return this.id.equals(other.id) && Objects.equal(this.overrideParent, other.overrideParent)
                && this.related.equals(other.related);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(this.id, this.overrideParent, this.related);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).omitNullValues().add("id", this.id)
                .add("parent", this.overrideParent).add("related", this.related).toString();
    }

}

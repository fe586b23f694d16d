package com.thingtalk.values;

import com.thingtalk.ast.NodeVisitor;
import com.thingtalk.ast.SourceRange;
import com.thingtalk.types.PrimitiveType;
import com.thingtalk.types.Type;
import com.thingtalk.util.SourceFormat;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Geographic location: absolute coordinates, a tag relative to the user
 * ({@code $location.home}), or a place name still to be geocoded.
 */
public final class LocationValue extends Value {

    /** Location specification. */
    public sealed interface Spec permits Absolute, Relative, Unresolved {}

    /**
     * Absolute coordinates.
     *
     * @param lat latitude
     * @param lon longitude
     * @param display human-readable name, or null
     */
    public record Absolute(double lat, double lon, String display) implements Spec {
        @Override
        public boolean equals(Object obj) {
            if (this == obj) return true;
            if (!(obj instanceof Absolute)) return false;
            Absolute that = (Absolute) obj;
            return Double.compare(lat, that.lat) == 0 && Double.compare(lon, that.lon) == 0;
        }

        @Override
        public int hashCode() {
            return Objects.hash(lat, lon);
        }
    }

    /**
     * Location relative to the user, e.g. "home", "work" or "current_location".
     *
     * @param tag the relative tag
     */
    public record Relative(String tag) implements Spec {
        public Relative {
            Objects.requireNonNull(tag, "tag must not be null");
        }
    }

    /**
     * Place known only by name.
     *
     * @param name the place name
     */
    public record Unresolved(String name) implements Spec {
        public Unresolved {
            Objects.requireNonNull(name, "name must not be null");
        }
    }

    private final Spec value;

    public LocationValue(SourceRange location, Spec value) {
        super(location);
        this.value = Objects.requireNonNull(value, "value must not be null");
    }

    public LocationValue(Spec value) {
        this(null, value);
    }

    public Spec value() {
        return value;
    }

    @Override
    public Type getType() {
        return PrimitiveType.LOCATION;
    }

    @Override
    public boolean isConstant() {
        return true;
    }

    @Override
    public boolean isConcrete() {
        return value instanceof Absolute;
    }

    @Override
    public Object toJS() {
        if (value instanceof Absolute) {
            Absolute abs = (Absolute) value;
            Map<String, Object> result = new LinkedHashMap<>();
            result.put("x", abs.lon());
            result.put("y", abs.lat());
            result.put("display", abs.display());
            return result;
        }
        throw new IllegalStateException("Unresolved location " + toSource());
    }

    @Override
    public LocationValue clone() {
        return new LocationValue(location, value);
    }

    @Override
    public void visit(NodeVisitor visitor) {
        visitor.enter(this);
        visitor.visitLocationValue(this);
        visitor.exit(this);
    }

    @Override
    public String toSource() {
        if (value instanceof Absolute) {
            Absolute abs = (Absolute) value;
            String coords = SourceFormat.number(abs.lat()) + ", " + SourceFormat.number(abs.lon());
            if (abs.display() != null) {
                return "new Location(" + coords + ", " + SourceFormat.quote(abs.display()) + ")";
            }
            return "new Location(" + coords + ")";
        }
        if (value instanceof Relative) {
            return "$location." + ((Relative) value).tag();
        }
        return "new Location(" + SourceFormat.quote(((Unresolved) value).name()) + ")";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof LocationValue)) return false;
        return value.equals(((LocationValue) obj).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "Location(" + value + ")";
    }
}

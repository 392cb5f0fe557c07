package io.surfworks.graphmatch.ir;

import java.util.Objects;

/**
 * Operator kind of a {@link Node}, written as {@code namespace::name}.
 *
 * <p>Kinds compare by their qualified name. The well-known primitive kinds are
 * interned so that {@link #of(String)} hands back the shared constant:
 * <ul>
 *   <li>{@link #PARAM} - the placeholder producing block inputs; in a pattern it matches any node</li>
 *   <li>{@link #RETURN} - the exit marker consuming block outputs</li>
 *   <li>{@link #CONSTANT} - a constant whose payload lives in the node attributes</li>
 * </ul>
 *
 * @param qualifiedName the full {@code namespace::name} form
 */
public record Kind(String qualifiedName) {

    public static final Kind PARAM = new Kind("prim::Param");
    public static final Kind RETURN = new Kind("prim::Return");
    public static final Kind CONSTANT = new Kind("prim::Constant");

    public Kind {
        Objects.requireNonNull(qualifiedName, "qualifiedName");
        int sep = qualifiedName.indexOf("::");
        if (sep <= 0 || sep + 2 >= qualifiedName.length()) {
            throw new IllegalArgumentException("Kind must look like namespace::name, got: " + qualifiedName);
        }
    }

    public static Kind of(String qualifiedName) {
        return switch (qualifiedName) {
            case "prim::Param" -> PARAM;
            case "prim::Return" -> RETURN;
            case "prim::Constant" -> CONSTANT;
            default -> new Kind(qualifiedName);
        };
    }

    public String namespace() {
        return qualifiedName.substring(0, qualifiedName.indexOf("::"));
    }

    public String name() {
        return qualifiedName.substring(qualifiedName.indexOf("::") + 2);
    }

    public boolean isParam() {
        return this.equals(PARAM);
    }

    @Override
    public String toString() {
        return qualifiedName;
    }
}

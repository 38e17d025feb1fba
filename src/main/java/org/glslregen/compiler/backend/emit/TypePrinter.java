package org.glslregen.compiler.backend.emit;

import org.glslregen.compiler.ir.Pack;
import org.glslregen.compiler.ir.Type;
import org.glslregen.compiler.ir.TypeId;

/**
 * Renders a type reference: precision qualifier, base name, then each array dimension.
 */
public class TypePrinter {

    private final Pack pack;

    public TypePrinter(Pack pack) {
        this.pack = pack;
    }

    /**
     * Appends e.g. {@code highp vec4[2][3]}.
     *
     * @throws org.glslregen.compiler.api.MissingEntityException if the type is not in the pack.
     */
    public void print(TypeId typeId, StringBuilder out) {
        Type type = pack.type(typeId);
        if (!type.precision().isEmpty()) {
            out.append(type.precision()).append(' ');
        }
        out.append(type.name());
        for (int size : type.arraySizes()) {
            out.append('[').append(size).append(']');
        }
    }
}

package com.ffibind.generator.model.type;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import com.ffibind.generator.model.path.ItemPath;
import com.ffibind.generator.util.NamingUtil;

import lombok.NonNull;

/**
 * Builds deterministic captions used to disambiguate synthesized names.
 * Example: {@code *const pkg::ns::MyClass} in context {@code pkg::ns} -> {@code my_class_const_ptr}.
 */
public class TypeCaptionVisitor implements BindingTypeVisitor<String> {

    /**
     * Package of the target language's standard library. Its types are captioned by their last segment only.
     */
    public static final String STANDARD_PACKAGE = "std";

    private final ItemPath context;

    public TypeCaptionVisitor(@NonNull ItemPath context) {
        this.context = context;
    }

    @Override
    public String visit(UnitType unit) {
        return "unit";
    }

    @Override
    public String visit(NamedType named) {
        String name = pathCaption(named.getPath());
        if (named.hasTypeArguments()) {
            name = name + NamingUtil.WORD_SEPARATOR + named.getTypeArguments().stream()
                    .map(argument -> argument.accept(this))
                    .collect(Collectors.joining(NamingUtil.WORD_SEPARATOR));
        }
        return name;
    }

    @Override
    public String visit(FunctionSignatureType signature) {
        return "fn";
    }

    @Override
    public String visit(IndirectionType indirection) {
        String constText = indirection.isConstant() ? "_const" : "";
        String kindText = switch (indirection.getKind()) {
            case RAW_POINTER -> "_ptr";
            case BORROW -> "_ref";
        };
        return indirection.getPointee().accept(this) + constText + kindText;
    }

    private String pathCaption(ItemPath path) {
        if (path.size() == 1 || STANDARD_PACKAGE.equals(path.firstSegment())) {
            return NamingUtil.toSnakeCase(path.lastSegment());
        }
        List<String> contextSegments = context.segments();
        int contextIndex = 0;
        List<String> parts = new ArrayList<>();
        for (String segment : path.segments()) {
            if (contextIndex >= 0 && contextIndex < contextSegments.size()
                    && segment.equals(contextSegments.get(contextIndex))) {
                contextIndex++;
                continue;
            }
            // First mismatch ends prefix stripping
            contextIndex = -1;
            String snakePart = NamingUtil.toSnakeCase(segment);
            if (parts.isEmpty() || !parts.get(parts.size() - 1).equals(snakePart)) {
                parts.add(snakePart);
            }
        }
        if (parts.isEmpty()) {
            return path.lastSegment();
        }
        return String.join(NamingUtil.WORD_SEPARATOR, parts);
    }
}

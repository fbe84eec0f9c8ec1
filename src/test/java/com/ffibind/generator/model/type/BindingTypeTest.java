package com.ffibind.generator.model.type;

import com.ffibind.generator.exception.TypeConversionException;
import com.ffibind.generator.model.path.ItemPath;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for BindingType captions, unsafety detection and indirection helpers.
 */
class BindingTypeTest {

    private static final ItemPath CONTEXT = ItemPath.of("pkg", "gui");

    private static final NamedType I32 = NamedType.builtIn("i32");
    private static final NamedType WIDGET = NamedType.of(ItemPath.of("pkg", "gui", "Widget"));
    private static final NamedType STRING = NamedType.of(ItemPath.of("pkg", "core", "QString"));

    @Test
    void testCaptionOfBuiltInAndUnit() {
        assertThat(I32.caption(CONTEXT)).isEqualTo("i32");
        assertThat(UnitType.INSTANCE.caption(CONTEXT)).isEqualTo("unit");
        assertThat(NamedType.builtIn("MyAlias").caption(CONTEXT)).isEqualTo("my_alias");
    }

    @Test
    void testCaptionOfStandardLibraryTypeUsesLastSegment() {
        NamedType cInt = NamedType.of(ItemPath.of("std", "os", "raw", "c_int"));

        assertThat(cInt.caption(CONTEXT)).isEqualTo("c_int");
    }

    @Test
    void testCaptionStripsSharedContextPrefix() {
        assertThat(WIDGET.caption(CONTEXT)).isEqualTo("widget");
        assertThat(STRING.caption(CONTEXT)).isEqualTo("core_q_string");
        assertThat(STRING.caption(ItemPath.of("other"))).isEqualTo("pkg_core_q_string");
    }

    @Test
    void testCaptionStopsStrippingAtFirstMismatch() {
        NamedType type = NamedType.of(ItemPath.of("pkg", "core", "pkg", "Thing"));

        assertThat(type.caption(ItemPath.of("pkg", "gui"))).isEqualTo("core_pkg_thing");
    }

    @Test
    void testCaptionCollapsesRepeatedSegment() {
        NamedType type = NamedType.of(ItemPath.of("pkg", "timer", "Timer"));

        assertThat(type.caption(ItemPath.of("pkg"))).isEqualTo("timer");
    }

    @Test
    void testCaptionFallsBackToLastSegmentWhenAllStripped() {
        NamedType type = NamedType.of(ItemPath.of("pkg", "gui"));

        assertThat(type.caption(ItemPath.of("pkg", "gui", "Widget"))).isEqualTo("gui");
    }

    @Test
    void testCaptionOfIndirections() {
        assertThat(IndirectionType.rawPointer(I32, true).caption(CONTEXT)).isEqualTo("i32_const_ptr");
        assertThat(IndirectionType.rawPointer(WIDGET, false).caption(CONTEXT)).isEqualTo("widget_ptr");
        assertThat(IndirectionType.borrow(WIDGET, true, "a").caption(CONTEXT)).isEqualTo("widget_const_ref");
        assertThat(IndirectionType.rawPointer(IndirectionType.rawPointer(I32, false), true).caption(CONTEXT))
                .isEqualTo("i32_ptr_const_ptr");
    }

    @Test
    void testCaptionOfTypeArgumentsAndFunctions() {
        NamedType list = NamedType.of(ItemPath.of("pkg", "core", "QList"), WIDGET, I32);
        FunctionSignatureType callback = FunctionSignatureType.of(UnitType.INSTANCE, WIDGET);

        assertThat(list.caption(CONTEXT)).isEqualTo("core_q_list_widget_i32");
        assertThat(callback.caption(CONTEXT)).isEqualTo("fn");
    }

    @Test
    void testCaptionIsDeterministic() {
        NamedType type = NamedType.of(ItemPath.of("pkg", "core", "QMap"),
                IndirectionType.rawPointer(STRING, true), FunctionSignatureType.of(I32));

        assertThat(type.caption(CONTEXT)).isEqualTo(type.caption(CONTEXT));
    }

    @Test
    void testRawPointerIsUnsafe() {
        assertThat(IndirectionType.rawPointer(I32, true).isUnsafe()).isTrue();
    }

    @Test
    void testUnsafetyPropagatesThroughNesting() {
        IndirectionType pointer = IndirectionType.rawPointer(WIDGET, false);

        assertThat(IndirectionType.borrow(pointer, true).isUnsafe()).isTrue();
        assertThat(NamedType.of(ItemPath.of("pkg", "core", "QList"), pointer).isUnsafe()).isTrue();
        assertThat(FunctionSignatureType.of(UnitType.INSTANCE, I32, pointer).isUnsafe()).isTrue();
        assertThat(FunctionSignatureType.of(pointer).isUnsafe()).isTrue();
    }

    @Test
    void testSafeTypesAreNotUnsafe() {
        assertThat(UnitType.INSTANCE.isUnsafe()).isFalse();
        assertThat(I32.isUnsafe()).isFalse();
        assertThat(IndirectionType.borrow(WIDGET, true).isUnsafe()).isFalse();
        assertThat(IndirectionType.borrow(IndirectionType.borrow(I32, false), true).isUnsafe()).isFalse();
        assertThat(NamedType.of(ItemPath.of("pkg", "core", "QList"), IndirectionType.borrow(I32, true)).isUnsafe())
                .isFalse();
        assertThat(FunctionSignatureType.of(I32, WIDGET).isUnsafe()).isFalse();
    }

    @Test
    void testIndirectionHelpers() {
        BindingType borrow = IndirectionType.borrow(WIDGET, false);

        assertThat(borrow.isBorrow()).isTrue();
        assertThat(borrow.isRawPointer()).isFalse();
        assertThat(borrow.lifetime()).isEmpty();
        assertThat(borrow.withLifetime("a").lifetime()).contains("a");
        assertThat(borrow.isConst()).isFalse();
        assertThat(borrow.withConst(true).isConst()).isTrue();
        assertThat(borrow.pointee()).isEqualTo(WIDGET);

        BindingType pointer = IndirectionType.rawPointer(WIDGET, true);
        assertThat(pointer.withLifetime("a")).isEqualTo(pointer);
    }

    @Test
    void testIndirectionHelpersRejectOtherShapes() {
        assertThatThrownBy(I32::isConst).isInstanceOf(TypeConversionException.class);
        assertThatThrownBy(I32::pointee).isInstanceOf(TypeConversionException.class);
        assertThatThrownBy(() -> UnitType.INSTANCE.asNamed()).isInstanceOf(TypeConversionException.class);
        assertThat(WIDGET.asNamed()).isSameAs(WIDGET);
    }

    @Test
    void testRawPointerCannotCarryLifetime() {
        assertThatThrownBy(() -> new IndirectionType(IndirectionKind.RAW_POINTER, "a", true, I32))
                .isInstanceOf(IllegalArgumentException.class);
    }
}

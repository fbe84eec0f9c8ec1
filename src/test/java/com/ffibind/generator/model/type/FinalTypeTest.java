package com.ffibind.generator.model.type;

import com.ffibind.generator.exception.TypeConversionException;
import com.ffibind.generator.model.path.ItemPath;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for FinalType conversions.
 */
class FinalTypeTest {

    private static final NamedType WIDGET = NamedType.of(ItemPath.of("pkg", "gui", "Widget"));
    private static final IndirectionType WIDGET_PTR = IndirectionType.rawPointer(WIDGET, false);

    @Test
    void testIdentity() {
        FinalType type = FinalType.identity(WIDGET_PTR);

        assertThat(type.getFfiType()).isEqualTo(WIDGET_PTR);
        assertThat(type.getSurfaceType()).isEqualTo(WIDGET_PTR);
        assertThat(type.getConversion()).isEqualTo(ConversionDescriptor.IDENTITY);
        assertThat(type.isConverted()).isFalse();
    }

    @Test
    void testPointerToBorrow() {
        FinalType type = FinalType.identity(WIDGET_PTR).pointerToBorrow(true);

        assertThat(type.getFfiType()).isEqualTo(WIDGET_PTR);
        assertThat(type.getSurfaceType()).isEqualTo(IndirectionType.borrow(WIDGET, true));
        assertThat(type.getSurfaceType().lifetime()).isEmpty();
        assertThat(type.getConversion()).isEqualTo(ConversionDescriptor.REFERENCE_FROM_POINTER);
    }

    @Test
    void testPointerToValue() {
        FinalType type = FinalType.identity(WIDGET_PTR).pointerToValue();

        assertThat(type.getFfiType()).isEqualTo(WIDGET_PTR);
        assertThat(type.getSurfaceType()).isEqualTo(WIDGET);
        assertThat(type.getConversion()).isEqualTo(ConversionDescriptor.VALUE_FROM_POINTER);
    }

    @Test
    void testConversionIsNotReapplied() {
        FinalType borrowed = FinalType.identity(WIDGET_PTR).pointerToBorrow(false);
        FinalType valued = FinalType.identity(WIDGET_PTR).pointerToValue();

        assertThatThrownBy(() -> borrowed.pointerToBorrow(true)).isInstanceOf(TypeConversionException.class);
        assertThatThrownBy(borrowed::pointerToValue).isInstanceOf(TypeConversionException.class);
        assertThatThrownBy(valued::pointerToValue).isInstanceOf(TypeConversionException.class);
        assertThatThrownBy(() -> valued.pointerToBorrow(true)).isInstanceOf(TypeConversionException.class);

        assertThat(borrowed.getSurfaceType()).isEqualTo(IndirectionType.borrow(WIDGET, false));
        assertThat(borrowed.getConversion()).isEqualTo(ConversionDescriptor.REFERENCE_FROM_POINTER);
        assertThat(valued.getSurfaceType()).isEqualTo(WIDGET);
    }

    @Test
    void testConversionRequiresRawPointer() {
        FinalType value = FinalType.identity(WIDGET);
        FinalType borrow = FinalType.identity(IndirectionType.borrow(WIDGET, true));

        assertThatThrownBy(() -> value.pointerToBorrow(true))
                .isInstanceOf(TypeConversionException.class)
                .hasMessageContaining("not a raw pointer");
        assertThatThrownBy(borrow::pointerToValue).isInstanceOf(TypeConversionException.class);
        assertThat(value.getConversion()).isEqualTo(ConversionDescriptor.IDENTITY);
    }

    @Test
    void testWithConversionKeepsFfiType() {
        NamedType owningHandle = NamedType.of(ItemPath.of("pkg", "CppBox"), WIDGET);

        FinalType type = FinalType.identity(WIDGET_PTR)
                .withConversion(ConversionDescriptor.OWNING_HANDLE_FROM_POINTER, owningHandle);

        assertThat(type.getFfiType()).isEqualTo(WIDGET_PTR);
        assertThat(type.getSurfaceType()).isEqualTo(owningHandle);
        assertThat(type.getConversion()).isEqualTo(ConversionDescriptor.OWNING_HANDLE_FROM_POINTER);
        assertThatThrownBy(() -> type.withConversion(ConversionDescriptor.OPTIONAL_WRAPPER_FROM_POINTER, WIDGET))
                .isInstanceOf(TypeConversionException.class);
        assertThatThrownBy(type::pointerToValue).isInstanceOf(TypeConversionException.class);
    }

    @Test
    void testFlagsConversionFromInteger() {
        NamedType cInt = NamedType.of(ItemPath.of("std", "os", "raw", "c_int"));
        NamedType flags = NamedType.of(ItemPath.of("pkg", "QFlags"), NamedType.of(ItemPath.of("pkg", "Alignment")));

        FinalType type = FinalType.identity(cInt).withConversion(ConversionDescriptor.INTEGER_FROM_FLAGS, flags);

        assertThat(type.getFfiType()).isEqualTo(cInt);
        assertThat(type.getConversion()).isEqualTo(ConversionDescriptor.INTEGER_FROM_FLAGS);
    }

    @Test
    void testWithConversionRejectsInvalidDescriptors() {
        FinalType value = FinalType.identity(WIDGET);

        assertThatThrownBy(() -> value.withConversion(ConversionDescriptor.IDENTITY, WIDGET))
                .isInstanceOf(TypeConversionException.class);
        assertThatThrownBy(() -> value.withConversion(ConversionDescriptor.SMART_POINTER_FROM_POINTER, WIDGET))
                .isInstanceOf(TypeConversionException.class);
    }
}

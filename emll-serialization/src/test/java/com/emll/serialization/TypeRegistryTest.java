package com.emll.serialization;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
public class TypeRegistryTest {

    @Mock
    private TypeFactory<SamplePoint> pointFactory;

    private TypeRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new TypeRegistry();
    }

    @Test
    void testRegisterUnderDeclaredName() {
        registry.register(SamplePoint.class, SamplePoint::new);

        assertThat(registry.isRegistered("SamplePoint")).isTrue();
        assertThat(registry.getType("SamplePoint")).isEqualTo(SamplePoint.class);
        assertThat(registry.create("SamplePoint", new DeserializationContext(registry, 8)))
                .isInstanceOf(SamplePoint.class);
    }

    @Test
    void testFactoryReceivesContext() {
        DeserializationContext context = new DeserializationContext(registry, 8);
        SamplePoint point = new SamplePoint(1, 2, "made");
        when(pointFactory.create(context)).thenReturn(point);
        registry.register("Point", SamplePoint.class, pointFactory);

        assertThat(registry.create("Point", context)).isSameAs(point);
        verify(pointFactory).create(context);
    }

    @Test
    void testDuplicateRegistrationFails() {
        registry.register(SamplePoint.class, SamplePoint::new);

        assertThatThrownBy(() -> registry.register(SamplePoint.class, SamplePoint::new))
                .isInstanceOf(DuplicateTypeException.class)
                .hasMessageContaining("SamplePoint")
                .satisfies(e -> assertThat(((SerializationException) e).getTypeName()).isEqualTo("SamplePoint"));
        // Another class under a taken name is also a duplicate
        assertThatThrownBy(() -> registry.register("SamplePoint", SampleShape.class, context -> new SampleShape()))
                .isInstanceOf(DuplicateTypeException.class);
    }

    @Test
    void testUnregisteredLookupFails() {
        assertThat(registry.isRegistered("Missing")).isFalse();

        assertThatThrownBy(() -> registry.create("Missing", new DeserializationContext(registry, 8)))
                .isInstanceOf(UnregisteredTypeException.class)
                .satisfies(e -> assertThat(((UnregisteredTypeException) e).getTypeName()).isEqualTo("Missing"));
        assertThatThrownBy(() -> registry.getType("Missing"))
                .isInstanceOf(UnregisteredTypeException.class);
    }

    @Test
    void testFactoryReturningNullFails() {
        registry.register("Broken", SamplePoint.class, context -> null);

        assertThatThrownBy(() -> registry.create("Broken", new DeserializationContext(registry, 8)))
                .isInstanceOf(SerializationException.class)
                .hasMessageContaining("Broken");
    }

    @Test
    void testInvalidRegistrations() {
        assertThatThrownBy(() -> registry.register("", SamplePoint.class, context -> new SamplePoint()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> registry.register("Point", SamplePoint.class, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testTypeNamesAreSorted() {
        registry.register(SampleShape.class, SampleShape::new)
                .register(SamplePoint.class, SamplePoint::new)
                .register(SampleChain.class, SampleChain::new);

        assertThat(registry.getTypeNames()).containsExactly("SampleChain", "SamplePoint", "SampleShape");
    }

    @Test
    void testRegistriesAreIndependent() {
        registry.register(SamplePoint.class, SamplePoint::new);

        assertThat(new TypeRegistry().isRegistered("SamplePoint")).isFalse();
    }
}

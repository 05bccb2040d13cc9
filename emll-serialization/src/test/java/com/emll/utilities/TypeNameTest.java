package com.emll.utilities;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

public class TypeNameTest {

    public static class Named {
        public static String getTypeName() {
            return "NamedThing";
        }
    }

    public static class DerivedFromNamed extends Named {
    }

    @Test
    void testPrimitiveNames() {
        assertThat(TypeName.of(int.class)).isEqualTo("int");
        assertThat(TypeName.of(Integer.class)).isEqualTo("int");
        assertThat(TypeName.of(long.class)).isEqualTo("int64");
        assertThat(TypeName.of(Double.class)).isEqualTo("double");
        assertThat(TypeName.of(Boolean.class)).isEqualTo("bool");
        assertThat(TypeName.of(String.class)).isEqualTo("string");
    }

    @Test
    void testVectorNames() {
        assertThat(TypeName.of(double[].class)).isEqualTo("vector(double)");
        assertThat(TypeName.of(String[][].class)).isEqualTo("vector(vector(string))");
    }

    @Test
    void testDeclaredTypeName() {
        assertThat(TypeName.of(Named.class)).isEqualTo("NamedThing");
        // Static accessors are not inherited as names
        assertThat(TypeName.of(DerivedFromNamed.class)).isEqualTo("DerivedFromNamed");
        assertThat(TypeName.of(StringBuilder.class)).isEqualTo("StringBuilder");
    }

    @Test
    void testPrimitiveClassLookup() {
        assertThat(TypeName.primitiveClassFor("int64")).contains(Long.class);
        assertThat(TypeName.primitiveClassFor("string")).contains(String.class);
        assertThat(TypeName.primitiveClassFor("NamedThing")).isEmpty();
    }
}

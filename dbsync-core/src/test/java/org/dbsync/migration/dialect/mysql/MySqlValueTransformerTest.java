package org.dbsync.migration.dialect.mysql;

import org.dbsync.model.ColumnModel;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class MySqlValueTransformerTest {

    private final MySqlValueTransformer transformer = new MySqlValueTransformer();

    private static ColumnModel column(String type, String extra) {
        return ColumnModel.builder().name("c").ordinalPosition(1).type(type).extra(extra).build();
    }

    @ParameterizedTest
    @ValueSource(strings = {"0", "-1", "3.14", "1e10", "'active'", "'it''s'", "b'101'", "0x1F",
            "NULL", "current_timestamp()", "CURRENT_TIMESTAMP(6)", "now()", "uuid()", "(1 + 2)"})
    void literalsAndExpressionsPassThroughWithoutType(String value) {
        assertThat(transformer.quote(value)).isEqualTo(value);
    }

    @Test
    void bareTextIsQuoted() {
        assertThat(transformer.quote("active")).isEqualTo("'active'");
        assertThat(transformer.quote("it's")).isEqualTo("'it''s'");
        assertThat(transformer.quote("")).isEqualTo("''");
    }

    @Test
    void nullBecomesSqlNull() {
        assertThat(transformer.quote(null, column("varchar(10)", ""))).isEqualTo("NULL");
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
            "varchar(10)     | 007    | '007'",
            "varchar(10)     | now    | 'now'",
            "char(4)         | null   | 'null'",
            "text            | abc(1) | 'abc(1)'",
            "enum('a','b')   | a      | 'a'",
            "set('x','y')    | x,y    | 'x,y'",
            "VARCHAR(10)     | 1e3    | '1e3'",
            "varchar(10)     | 'it''s' | 'it''s'"
    })
    void characterDefaultsAreAlwaysStrings(String type, String value, String expected) {
        assertThat(transformer.quote(value, column(type, ""))).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
            "datetime     | 2024-01-01 00:00:00 | '2024-01-01 00:00:00'",
            "date         | 0000-00-00          | '0000-00-00'",
            "timestamp    | current_timestamp() | current_timestamp()",
            "datetime(6)  | CURRENT_TIMESTAMP(6) | CURRENT_TIMESTAMP(6)",
            "year         | 2024                | '2024'"
    })
    void temporalDefaults(String type, String value, String expected) {
        assertThat(transformer.quote(value, column(type, ""))).isEqualTo(expected);
    }

    @Test
    void generatedExpressionOnCharacterColumnPassesThrough() {
        assertThat(transformer.quote("uuid()", column("char(36)", "DEFAULT_GENERATED")))
                .isEqualTo("uuid()");
    }

    @Test
    void sqlNullSpelledByMariaDbOnNullableCharacterColumn() {
        assertThat(transformer.quote("NULL", column("varchar(10)", ""))).isEqualTo("NULL");

        ColumnModel notNull = column("varchar(10)", "").toBuilder().nullable(false).build();
        assertThat(transformer.quote("NULL", notNull)).isEqualTo("'NULL'");
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', quoteCharacter = '"', value = {
            "int(11)       | 007      | 007",
            "decimal(10,2) | 0.00     | 0.00",
            "bit(1)        | b'1'     | b'1'",
            "json          | (json_array()) | (json_array())"
    })
    void numericAndOtherTypesKeepLiterals(String type, String value, String expected) {
        assertThat(transformer.quote(value, column(type, ""))).isEqualTo(expected);
    }

    @Test
    void baseTypeIgnoresLengthAndModifiers() {
        assertThat(MySqlValueTransformer.baseType("int(11) unsigned")).isEqualTo("int");
        assertThat(MySqlValueTransformer.baseType("ENUM('a')")).isEqualTo("enum");
        assertThat(MySqlValueTransformer.baseType(null)).isEmpty();
    }
}

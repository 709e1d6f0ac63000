package work.canopy.types;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.canopy.error.DocumentParseException;
import work.canopy.error.ErrorKind;
import work.canopy.error.ReferenceException;
import work.canopy.parse.YamlDocuments;

class SemanticTypeRegistryTest {
    private static final String TYPES = """
        types:
          park_boundaries:
            category: vector
            format: geojson
            description: Park polygons
            geometry: polygon
          land_surface_temperature:
            category: raster
            format: tiff
          park_buffers:
            category: vector
            format: geojson
        """;

    private final SemanticTypeRegistry registry = SemanticTypeRegistry.fromMap(YamlDocuments.parse(TYPES, "types.yml"), "types.yml");

    @Test
    void exposesFormatCategoryAndExtraFields() {
        assertEquals("geojson", registry.format("park_boundaries"));
        assertEquals("raster", registry.category("land_surface_temperature"));
        assertEquals(Map.of("geometry", "polygon"), registry.get("park_boundaries").extra());
        assertTrue(registry.isValid("park_buffers"));
        assertFalse(registry.isValid("parks"));
        assertEquals(List.of("land_surface_temperature", "park_boundaries", "park_buffers"), registry.allTypes());
    }

    @Test
    void unknownTypeCarriesCaseInsensitiveSuggestions() {
        var ex = assertThrows(ReferenceException.class, () -> registry.get("Park_Buffer"));
        assertEquals(ErrorKind.UNKNOWN_SEMANTIC_TYPE, ex.kind());
        assertEquals(List.of("park_buffers"), ex.suggestions());
    }

    @Test
    void categoryAndFormatAreRequired() {
        var yaml = "types:\n  broken:\n    format: geojson\n";
        var ex = assertThrows(DocumentParseException.class,
            () -> SemanticTypeRegistry.fromMap(YamlDocuments.parse(yaml, "t.yml"), "t.yml"));
        assertEquals(ErrorKind.MISSING_FIELD, ex.kind());
    }
}

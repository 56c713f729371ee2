// file: client/src/test/java/io/tilelite/client/CliSpec.java
package io.tilelite.client;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CliSpec {

    @Test
    void base_url_flag_is_split_from_the_command() {
        var parsed = Cli.parseBaseUrl(new String[]{"--base-url", "http://tiles:9000", "layers"});
        assertEquals("http://tiles:9000", parsed.getKey());
        assertArrayEquals(new String[]{"layers"}, parsed.getValue());
    }

    @Test
    void default_base_url_without_flag() {
        var parsed = Cli.parseBaseUrl(new String[]{"meta", "dem", "4"});
        assertEquals("http://localhost:8080", parsed.getKey());
        assertEquals(3, parsed.getValue().length);
    }

    @Test
    void tiles_path_with_and_without_bounding_box() {
        assertEquals("/layers/dem/4/tiles", Cli.tilesPath("dem", "4", new String[0]));
        assertEquals("/layers/dem/4/tiles?minCol=0&minRow=1&maxCol=2&maxRow=3",
                Cli.tilesPath("dem", "4", new String[]{"0", "1", "2", "3"}));
    }

    @Test
    void layer_names_are_url_encoded() {
        assertEquals("/layers/sea%20level/2", Cli.layerPath("sea level", "2"));
    }

    @Test
    void incomplete_bounding_box_is_rejected() {
        assertThrows(Cli.CliException.class, () -> Cli.tilesPath("dem", "4", new String[]{"0", "1"}));
    }
}

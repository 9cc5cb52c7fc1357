package edu.pucmm.ferrovia.io;

import edu.pucmm.ferrovia.model.Train;
import edu.pucmm.ferrovia.model.TrainCategory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RosterLoaderTest {

    private final RosterLoader loader = new RosterLoader();

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Lee la lista, salta líneas vacías y asigna ids en orden")
    void testListaValida() throws Exception {
        Path input = tempDir.resolve("input.txt");
        Files.writeString(input, "e 10 6\n\nW 6 7\n   \nE 3 10\nw 1 99\n");

        List<Train> trains = loader.load(input);

        assertEquals(4, trains.size());
        assertEquals(TrainCategory.EAST_LOW, trains.get(0).getCategory());
        assertEquals(10, trains.get(0).getLoadingTime());
        assertEquals(6, trains.get(0).getCrossingTime());
        assertEquals(TrainCategory.WEST_HIGH, trains.get(1).getCategory());
        assertEquals(TrainCategory.EAST_HIGH, trains.get(2).getCategory());
        assertEquals(TrainCategory.WEST_LOW, trains.get(3).getCategory());
        for (int i = 0; i < trains.size(); i++) {
            assertEquals(i, trains.get(i).getId());
        }
    }

    @Test
    @DisplayName("Un archivo vacío produce una lista vacía")
    void testArchivoVacio() throws Exception {
        assertTrue(loader.load(new StringReader("\n  \n")).isEmpty());
    }

    @Test
    @DisplayName("Código desconocido aborta la carga indicando la línea")
    void testCodigoDesconocido() {
        RosterLoadException e = assertThrows(RosterLoadException.class,
                () -> loader.load(new StringReader("E 1 1\nN 2 2\n")));
        assertEquals(2, e.getLineNumber());
        assertEquals("N 2 2", e.getLine());
        assertTrue(e.getMessage().contains("línea 2"));
    }

    @Test
    @DisplayName("Tiempos fuera de [1,99] o no numéricos abortan la carga")
    void testTiemposInvalidos() {
        assertEquals(1, assertThrows(RosterLoadException.class,
                () -> loader.load(new StringReader("E 0 5\n"))).getLineNumber());
        assertEquals(1, assertThrows(RosterLoadException.class,
                () -> loader.load(new StringReader("w 5 100\n"))).getLineNumber());
        assertEquals(3, assertThrows(RosterLoadException.class,
                () -> loader.load(new StringReader("E 1 1\n\nW x 2\n"))).getLineNumber());
    }

    @Test
    @DisplayName("Líneas con campos de más o de menos abortan la carga")
    void testCantidadDeCampos() {
        assertThrows(RosterLoadException.class, () -> loader.load(new StringReader("E 1\n")));
        assertThrows(RosterLoadException.class, () -> loader.load(new StringReader("E 1 2 3\n")));
        assertThrows(RosterLoadException.class, () -> loader.load(new StringReader("EE 1 2\n")));
    }

    @Test
    @DisplayName("Un archivo inexistente se informa sin número de línea")
    void testArchivoInexistente() {
        RosterLoadException e = assertThrows(RosterLoadException.class,
                () -> loader.load(tempDir.resolve("no-existe.txt")));
        assertEquals(-1, e.getLineNumber());
        assertNotNull(e.getCause());
    }
}

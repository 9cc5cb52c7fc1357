package edu.pucmm.ferrovia.io;

import edu.pucmm.ferrovia.model.Train;
import edu.pucmm.ferrovia.model.TrainCategory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Lee la lista de trenes. Cada línea no vacía es {@code <código> <carga> <cruce>}, con
 * código E/e/W/w y tiempos entre 1 y 99. Los ids se asignan en orden de aparición.
 * Cualquier línea inválida aborta la carga completa.
 */
public class RosterLoader {
    private static final Logger logger = Logger.getLogger(RosterLoader.class.getName());

    public List<Train> load(Path path) throws RosterLoadException {
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            List<Train> trains = load(reader);
            logger.info("Cargados " + trains.size() + " trenes desde " + path);
            return trains;
        } catch (IOException e) {
            throw new RosterLoadException("No se pudo leer " + path + ": " + e.getMessage(), e);
        }
    }

    public List<Train> load(Reader source) throws RosterLoadException, IOException {
        BufferedReader reader = source instanceof BufferedReader br ? br : new BufferedReader(source);
        List<Train> trains = new ArrayList<>();
        String line;
        int lineNumber = 0;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            trains.add(parseLine(line, lineNumber, trains.size()));
        }
        return trains;
    }

    /**
     * Interpreta una línea.
     *
     * @param line       texto de la línea
     * @param lineNumber número de línea en el archivo, para el mensaje de error
     * @param id         id que recibe el tren
     */
    Train parseLine(String line, int lineNumber, int id) throws RosterLoadException {
        String[] tokens = line.trim().split("\\s+");
        if (tokens.length != 3) {
            throw new RosterLoadException(lineNumber, line, "se esperaban 3 campos");
        }
        if (tokens[0].length() != 1) {
            throw new RosterLoadException(lineNumber, line, "código de sentido inválido");
        }
        TrainCategory category = TrainCategory.fromCode(tokens[0].charAt(0));
        if (category == null) {
            throw new RosterLoadException(lineNumber, line, "código de sentido desconocido '" + tokens[0] + "'");
        }
        int loading = parseDuration(tokens[1], line, lineNumber, "carga");
        int crossing = parseDuration(tokens[2], line, lineNumber, "cruce");
        return new Train(id, category, loading, crossing);
    }

    private static int parseDuration(String token, String line, int lineNumber, String name) throws RosterLoadException {
        int value;
        try {
            value = Integer.parseInt(token);
        } catch (NumberFormatException e) {
            throw new RosterLoadException(lineNumber, line, "tiempo de " + name + " no numérico");
        }
        if (value < Train.MIN_DURATION || value > Train.MAX_DURATION) {
            throw new RosterLoadException(lineNumber, line, "tiempo de " + name + " fuera de rango");
        }
        return value;
    }
}

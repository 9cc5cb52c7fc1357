package edu.pucmm.ferrovia.io;

/**
 * Error al leer la lista de trenes. Si viene de una línea concreta, indica su número y su texto.
 */
public class RosterLoadException extends Exception {
    private final int lineNumber;
    private final String line;

    public RosterLoadException(String message, Throwable cause) {
        super(message, cause);
        this.lineNumber = -1;
        this.line = null;
    }

    public RosterLoadException(int lineNumber, String line, String reason) {
        super("Error en la línea " + lineNumber + " (" + reason + "): " + line);
        this.lineNumber = lineNumber;
        this.line = line;
    }

    /**
     * @return número de línea (desde 1), o -1 si el error no es de una línea
     */
    public int getLineNumber() {
        return lineNumber;
    }

    public String getLine() {
        return line;
    }
}

package edu.pucmm.ferrovia.model;

/**
 * Combinación sentido × prioridad. Cada categoría tiene su propia cola de listos
 * y un código de una letra en el archivo de entrada (mayúscula = prioridad alta).
 */
public enum TrainCategory {
    EAST_HIGH(TrackDirection.EAST, TrainPriority.HIGH, 'E'),
    EAST_LOW(TrackDirection.EAST, TrainPriority.LOW, 'e'),
    WEST_HIGH(TrackDirection.WEST, TrainPriority.HIGH, 'W'),
    WEST_LOW(TrackDirection.WEST, TrainPriority.LOW, 'w');

    private final TrackDirection direction;
    private final TrainPriority priority;
    private final char code;

    TrainCategory(TrackDirection direction, TrainPriority priority, char code) {
        this.direction = direction;
        this.priority = priority;
        this.code = code;
    }

    public TrackDirection getDirection() {
        return direction;
    }

    public TrainPriority getPriority() {
        return priority;
    }

    /**
     * Obtiene la categoría para un sentido y una prioridad.
     */
    public static TrainCategory of(TrackDirection direction, TrainPriority priority) {
        return switch (direction) {
            case EAST -> priority == TrainPriority.HIGH ? EAST_HIGH : EAST_LOW;
            case WEST -> priority == TrainPriority.HIGH ? WEST_HIGH : WEST_LOW;
        };
    }

    /**
     * Traduce el código del archivo de entrada.
     *
     * @param code letra E, e, W o w
     * @return la categoría, o null si el código no es reconocido
     */
    public static TrainCategory fromCode(char code) {
        for (TrainCategory category : values()) {
            if (category.code == code) {
                return category;
            }
        }
        return null;
    }
}

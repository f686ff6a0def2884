package guraa.wiringdoc.model;

/**
 * Stages of a pack build. A build only ever moves forward through them.
 */
public enum BuildStage {
    LOADED,
    CROPPED,
    SHUFFLED,
    ASSEMBLED,
    SERIALIZED
}

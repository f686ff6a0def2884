package guraa.wiringdoc.cli;

/**
 * Thrown while parsing the command line when the arguments do not form a valid command.
 */
class UsageException extends RuntimeException {

    UsageException(String message) {
        super(message);
    }
}

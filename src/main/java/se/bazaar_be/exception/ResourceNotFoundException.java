package se.bazaar_be.exception;

public class ResourceNotFoundException extends BusinessLogicException {

    public ResourceNotFoundException(String message) {
        super(ErrorCode.NOT_FOUND, message);
    }
}

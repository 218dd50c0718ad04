package workhub.workhubbackend.common;

public interface ResponseMessage {

    String VALIDATION_FAIL = "Validation failed.";

    String NOT_FOUND = "Not found.";

    String AUTHENTICATION_FAIL = "Authentication required.";

    String DATABASE_ERROR = "Database Error.";
}

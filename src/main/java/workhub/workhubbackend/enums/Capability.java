package workhub.workhubbackend.enums;

public enum Capability {
    VIEW,
    EDIT,
    DELETE,
    ADMIN
}

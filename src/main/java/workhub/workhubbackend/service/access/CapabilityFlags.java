package workhub.workhubbackend.service.access;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import workhub.workhubbackend.enums.Capability;

/**
 * 모듈 하나에 대한 view/edit/delete/admin 플래그
 */
@Getter
@ToString
@EqualsAndHashCode
public final class CapabilityFlags {

    public static final CapabilityFlags NONE = new CapabilityFlags(false, false, false, false);

    private final boolean view;
    private final boolean edit;
    private final boolean delete;
    private final boolean admin;

    public CapabilityFlags(boolean view, boolean edit, boolean delete, boolean admin) {
        this.view = view;
        this.edit = edit;
        this.delete = delete;
        this.admin = admin;
    }

    public boolean allows(Capability capability) {
        return switch (capability) {
            case VIEW -> view;
            case EDIT -> edit;
            case DELETE -> delete;
            case ADMIN -> admin;
        };
    }

    /**
     * edit/delete/admin 권한은 view 권한을 전제로 한다
     */
    public boolean isConsistent() {
        return view || !(edit || delete || admin);
    }
}

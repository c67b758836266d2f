package hooks.phase;

import hooks.exceptions.UnknownOperationException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OperationTest {

    @Test
    void parsesNamesCaseInsensitively() {
        assertThat(Operation.fromName("install")).isEqualTo(Operation.INSTALL);
        assertThat(Operation.fromName(" Rollback ")).isEqualTo(Operation.ROLLBACK);
    }

    @Test
    void rejectsUnknownNames() {
        assertThatThrownBy(() -> Operation.fromName("test"))
                .isInstanceOf(UnknownOperationException.class)
                .hasMessageContaining("test");
        assertThatThrownBy(() -> Operation.fromName(null))
                .isInstanceOf(UnknownOperationException.class);
    }

    @Test
    void displayNameIsLowerCase() {
        assertThat(Operation.UPGRADE.displayName()).isEqualTo("upgrade");
    }
}

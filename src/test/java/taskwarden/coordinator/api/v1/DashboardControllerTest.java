package taskwarden.coordinator.api.v1;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DashboardControllerTest {

    @Test
    @DisplayName("limit defaults to 60 and is capped at 1000")
    void parseLimit() {
        assertEquals(60, DashboardController.parseLimit(null));
        assertEquals(60, DashboardController.parseLimit(List.of()));
        assertEquals(5, DashboardController.parseLimit(List.of("5")));
        assertEquals(1000, DashboardController.parseLimit(List.of("50000")));
    }

    @Test
    @DisplayName("Non-numeric or non-positive limits are rejected")
    void invalidLimit() {
        assertThrows(IllegalArgumentException.class, () -> DashboardController.parseLimit(List.of("abc")));
        assertThrows(IllegalArgumentException.class, () -> DashboardController.parseLimit(List.of("0")));
    }
}

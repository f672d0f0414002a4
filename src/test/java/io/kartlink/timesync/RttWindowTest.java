package io.kartlink.timesync;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class RttWindowTest {

    @Test
    void keepsOnlyTheNewestSamples() {
        RttWindow window = new RttWindow(3);
        Assertions.assertEquals(0.0d, window.average());
        Assertions.assertEquals(0, window.size());

        window.add(10L);
        window.add(20L);
        window.add(30L);
        window.add(60L);

        Assertions.assertEquals(3, window.size());
        Assertions.assertEquals(110.0d / 3.0d, window.average(), 1e-9);
        Assertions.assertEquals(60L, window.last());
    }

    @Test
    void rejectsInvalidInput() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> new RttWindow(0));
        RttWindow window = new RttWindow(2);
        Assertions.assertThrows(IllegalArgumentException.class, () -> window.add(-1L));
    }
}

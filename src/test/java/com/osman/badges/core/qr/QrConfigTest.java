package com.osman.badges.core.qr;

import com.osman.badges.core.InvalidConfigException;
import org.junit.jupiter.api.Test;

import java.awt.Color;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class QrConfigTest {

    @Test
    void defaultsMatchDocumentedValues() {
        QrConfig config = QrConfig.defaults();

        assertEquals(3, config.version());
        assertEquals(ErrorCorrection.L, config.errorCorrection());
        assertEquals(10, config.boxSize());
        assertEquals(4, config.border());
        assertEquals(Color.BLACK, config.fillColor());
        assertEquals(Color.WHITE, config.backColor());
    }

    @Test
    void rejectsOutOfRangeValues() {
        assertThrows(InvalidConfigException.class, () -> QrConfig.defaults().withVersion(0));
        assertThrows(InvalidConfigException.class, () -> QrConfig.defaults().withVersion(41));
        assertThrows(InvalidConfigException.class, () -> QrConfig.defaults().withBoxSize(0));
        assertThrows(InvalidConfigException.class, () -> QrConfig.defaults().withBorder(-1));
        assertThrows(InvalidConfigException.class, () -> QrConfig.defaults().withColors(null, Color.WHITE));
    }

    @Test
    void zeroBorderIsAllowed() {
        assertEquals(0, QrConfig.defaults().withBorder(0).border());
    }

    @Test
    void parsesErrorCorrectionCaseInsensitively() {
        assertEquals(ErrorCorrection.Q, ErrorCorrection.parse(" q "));
        assertThrows(IllegalArgumentException.class, () -> ErrorCorrection.parse("X"));
    }
}

package club.ppmc.visualsync.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import club.ppmc.visualsync.exception.SourceFormattingException;
import club.ppmc.visualsync.model.Settings;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

class SourceFormattingServiceTest {

    private Settings settings;
    private SourceFormattingService formattingService;

    @BeforeEach
    void setUp() {
        settings = new Settings();
        SettingsService settingsService = mock(SettingsService.class);
        when(settingsService.getSettings()).thenReturn(settings);
        formattingService = new SourceFormattingService(settingsService);
    }

    @Test
    void withoutCommandSourceIsReturnedAsIs() throws Exception {
        assertFalse(formattingService.isEnabled());
        assertEquals("Text( 'x' )", formattingService.format("Text( 'x' )"));
    }

    @Test
    void formatOnMutationSwitchDisablesFormatter() throws Exception {
        settings.setFormatterCommand(new ArrayList<>(List.of("definitely-not-a-formatter")));
        settings.setFormatOnMutation(false);

        assertFalse(formattingService.isEnabled());
        assertEquals("x", formattingService.format("x"));
    }

    @Test
    void missingExecutableFails() {
        settings.setFormatterCommand(new ArrayList<>(List.of("definitely-not-a-formatter-binary")));

        assertTrue(formattingService.isEnabled());
        assertThrows(SourceFormattingException.class, () -> formattingService.format("x"));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void sourceIsPipedThroughCommand() throws Exception {
        settings.setFormatterCommand(new ArrayList<>(List.of("cat")));

        assertEquals("Column(\n  children: [],\n)\n", formattingService.format("Column(\n  children: [],\n)\n"));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void nonZeroExitFails() {
        settings.setFormatterCommand(new ArrayList<>(List.of("sh", "-c", "cat >/dev/null; echo bad >&2; exit 3")));

        var e = assertThrows(SourceFormattingException.class, () -> formattingService.format("x"));
        assertTrue(e.getMessage().contains("bad"));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void commandThatNeverReadsInputTimesOut() {
        settings.setFormatterCommand(new ArrayList<>(List.of("sleep", "15")));
        settings.setFormatterTimeoutSeconds(1);
        String source = "Text('x'),\n".repeat(100_000);

        long started = System.nanoTime();
        var e = assertThrows(SourceFormattingException.class, () -> formattingService.format(source));

        assertTrue(e.getMessage().contains("1"));
        assertTrue(Duration.ofNanos(System.nanoTime() - started).toSeconds() < 10);
    }
}

package club.ppmc.visualsync.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import club.ppmc.visualsync.config.AppConfig;
import club.ppmc.visualsync.exception.DocumentNotOpenException;
import club.ppmc.visualsync.model.CommandOutcome;
import club.ppmc.visualsync.model.InsertPosition;
import club.ppmc.visualsync.model.NodeRef;
import club.ppmc.visualsync.model.SyncSnapshot;
import club.ppmc.visualsync.model.request.InsertNodeRequest;
import club.ppmc.visualsync.model.request.SelectNodeRequest;
import club.ppmc.visualsync.model.request.WrapNodeRequest;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.messaging.simp.SimpMessagingTemplate;

class DocumentSessionServiceTest {

    private static final String SCREEN = String.join("\n",
            "Column(",
            "  children: [",
            "    Text('One'),",
            "  ],",
            ")",
            "");

    @TempDir
    Path workspace;

    private SimpMessagingTemplate template;
    private DocumentSessionService sessionService;

    @BeforeEach
    void setUp() throws IOException {
        var settingsService = new SettingsService(workspace.toString(), "", 5, 60_000, 60_000, 20);
        settingsService.init();
        template = mock(SimpMessagingTemplate.class);
        var fileService = new FileService(settingsService);
        sessionService = new DocumentSessionService(
                settingsService,
                fileService,
                new SourceFormattingService(settingsService),
                new SyncNotificationService(template, AppConfig.createGson()));
        Files.createDirectories(workspace.resolve("demo/lib"));
        Files.writeString(workspace.resolve("demo/lib/main.dart"), SCREEN, StandardCharsets.UTF_8);
    }

    @AfterEach
    void tearDown() {
        sessionService.shutdown();
    }

    @Test
    void commandsBeforeOpenAreRejected() {
        assertFalse(sessionService.isDocumentOpen());
        assertNull(sessionService.snapshot().buffer());

        var e = assertThrows(DocumentNotOpenException.class, sessionService::undo);
        assertEquals("undo", e.getOperation());
    }

    @Test
    void openParsesFileAndBroadcasts() throws Exception {
        SyncSnapshot snapshot = sessionService.openDocument("demo", "lib/main.dart");

        assertEquals("demo/lib/main.dart", snapshot.buffer().path());
        assertEquals(1, snapshot.tree().getChildren().size());
        assertFalse(snapshot.canUndo());
        verify(template, atLeastOnce()).convertAndSend(eq(SyncNotificationService.TREE_TOPIC), (Object) anyString());
    }

    @Test
    void openingMissingFileFails() {
        assertThrows(IOException.class, () -> sessionService.openDocument("demo", "lib/none.dart"));
    }

    @Test
    void structuralEditsAreSavedToDisk() throws Exception {
        sessionService.openDocument("demo", "lib/main.dart");

        var outcome = sessionService.insertNode(
                new InsertNodeRequest(new NodeRef("Text", 3), "Text('Two')", InsertPosition.AFTER));
        assertEquals(CommandOutcome.APPLIED, outcome);
        assertTrue(sessionService.snapshot().buffer().dirty());

        SyncSnapshot saved = sessionService.saveDocument();

        assertFalse(saved.buffer().dirty());
        String onDisk = Files.readString(workspace.resolve("demo/lib/main.dart"), StandardCharsets.UTF_8);
        assertTrue(onDisk.contains("    Text('Two'),"));
    }

    @Test
    void rawEditsAreParsedBeforeSave() throws Exception {
        sessionService.openDocument("demo", "lib/main.dart");

        assertEquals(CommandOutcome.APPLIED, sessionService.applyCode(SCREEN.replace("One", "Uno")));
        assertTrue(sessionService.snapshot().reparsePending());

        SyncSnapshot saved = sessionService.saveDocument();

        assertFalse(saved.reparsePending());
        assertTrue(saved.tree().getChildren().get(0).getChildren().get(0).getSnippet().contains("Uno"));
    }

    @Test
    void selectionDrivesWrapAndUndo() throws Exception {
        sessionService.openDocument("demo", "lib/main.dart");

        assertEquals(CommandOutcome.APPLIED,
                sessionService.selectNode(new SelectNodeRequest(new NodeRef("Text", 3), null, null)));
        assertEquals(CommandOutcome.APPLIED,
                sessionService.wrapNode(new WrapNodeRequest(null, "Center", Map.of())));
        assertTrue(sessionService.snapshot().buffer().text().contains("Center(child: Text('One'))"));

        assertEquals(CommandOutcome.APPLIED, sessionService.undo());
        assertEquals(SCREEN, sessionService.snapshot().buffer().text());
        assertEquals(CommandOutcome.NO_OP, sessionService.undo());
    }
}

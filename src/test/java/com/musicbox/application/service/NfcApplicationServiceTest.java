package com.musicbox.application.service;

import com.musicbox.application.dto.AssociationSessionDto;
import com.musicbox.application.dto.NfcStatusDto;
import com.musicbox.application.dto.SessionEventDto;
import com.musicbox.application.dto.TagDissociatedEvent;
import com.musicbox.domain.exception.HardwareException;
import com.musicbox.domain.exception.NotFoundException;
import com.musicbox.domain.exception.ValidationException;
import com.musicbox.domain.model.DetectionAction;
import com.musicbox.domain.model.DetectionResult;
import com.musicbox.domain.model.SessionState;
import com.musicbox.domain.port.NfcHardwareAdapter;
import com.musicbox.infrastructure.mock.MockNfcReaderAdapter;
import com.musicbox.support.BlockingTagRepository;
import com.musicbox.support.InMemoryTagRepository;
import com.musicbox.support.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class NfcApplicationServiceTest {

    private MutableClock clock;
    private MockNfcReaderAdapter reader;
    private InMemoryTagRepository tagRepository;
    private AssociationService associationService;
    private ExecutorService detectionExecutor;
    private ScheduledExecutorService sweepScheduler;
    private NfcApplicationService service;

    private final List<String> playbackUids = new CopyOnWriteArrayList<>();
    private final List<DetectionResult> results = new CopyOnWriteArrayList<>();
    private final List<SessionEventDto> sessionEvents = new CopyOnWriteArrayList<>();
    private final List<TagDissociatedEvent> dissociations = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-01-01T10:00:00Z"));
        reader = new MockNfcReaderAdapter();
        tagRepository = new InMemoryTagRepository();
        associationService = new AssociationService(tagRepository, Optional.empty(), clock, 60);
        detectionExecutor = Executors.newSingleThreadExecutor();
        sweepScheduler = Executors.newSingleThreadScheduledExecutor();
        service = new NfcApplicationService(reader, associationService, new NfcEventDispatcher(),
                tagRepository, detectionExecutor, sweepScheduler, 30);

        service.registerTagDetectedCallback(playbackUids::add);
        service.registerAssociationCallback(results::add);
        service.registerSessionCallback(sessionEvents::add);
        service.registerDissociationCallback(dissociations::add);
    }

    @AfterEach
    void tearDown() {
        detectionExecutor.shutdownNow();
        sweepScheduler.shutdownNow();
    }

    @Test
    void tagWithoutSessionTriggersPlaybackWithRawUid() throws Exception {
        service.startSystem();

        reader.simulateTagDetection("ABCD1234EF");
        drainDetections();

        assertEquals(List.of("ABCD1234EF"), playbackUids);
        assertEquals(1, results.size());
        assertEquals(DetectionAction.TAG_DETECTED, results.get(0).getAction());
    }

    @Test
    void tagDuringSessionIsConsumedByAssociation() throws Exception {
        service.startSystem();
        AssociationSessionDto session = service.startAssociationUseCase("p1", null, false);

        reader.simulateTagDetection("04:F7:ED:A4:DF:61:81");
        drainDetections();

        assertTrue(playbackUids.isEmpty());
        assertEquals(1, results.size());
        assertEquals(DetectionAction.ASSOCIATION_SUCCESS, results.get(0).getAction());
        assertEquals(SessionState.SUCCESS.name(), service.getSessionUseCase(session.getSessionId()).getState());
        assertEquals("p1", tagRepository.get("04f7eda4df6181").getAssociatedPlaylistId());
    }

    @Test
    void duplicateDuringSessionAlsoSuppressesPlayback() throws Exception {
        tagRepository.givenTagBoundTo("04f7eda4df6181", "p1");
        service.startSystem();
        service.startAssociationUseCase("p2", 60, false);

        reader.simulateTagDetection("04f7eda4df6181");
        drainDetections();

        assertTrue(playbackUids.isEmpty());
        assertEquals(DetectionAction.DUPLICATE_ASSOCIATION, results.get(0).getAction());
    }

    @Test
    void playbackResumesOnceTheSessionIsOver() throws Exception {
        service.startSystem();
        service.startAssociationUseCase("p1", 60, false);

        reader.simulateTagDetection("04f7eda4df6181");
        drainDetections();
        reader.simulateTagDetection("04f7eda4df6181");
        drainDetections();

        assertEquals(List.of("04f7eda4df6181"), playbackUids);
        assertEquals(2, results.size());
        assertEquals(DetectionAction.TAG_DETECTED, results.get(1).getAction());
        assertEquals("p1", results.get(1).getAssociatedPlaylistId());
    }

    @Test
    void invalidUidIsDropped() throws Exception {
        service.startSystem();

        reader.simulateTagDetection("not-a-tag");
        drainDetections();

        assertTrue(playbackUids.isEmpty());
        assertTrue(results.isEmpty());
        assertEquals(0, tagRepository.count());
    }

    @Test
    void failingPlaybackCallbackDoesNotBlockOthers() throws Exception {
        service.registerTagDetectedCallback(uid -> {
            throw new IllegalStateException("boom");
        });
        service.startSystem();

        reader.simulateTagDetection("ABCD1234EF");
        drainDetections();

        assertEquals(List.of("ABCD1234EF"), playbackUids);
        assertEquals(1, results.size());
    }

    @Test
    void sessionLifecycleIsPublished() {
        AssociationSessionDto session = service.startAssociationUseCase("p1", 30, true);

        assertTrue(service.stopAssociationUseCase(session.getSessionId()));
        assertFalse(service.stopAssociationUseCase(session.getSessionId()));

        assertEquals(2, sessionEvents.size());
        assertEquals(SessionEventDto.STARTED, sessionEvents.get(0).type());
        assertEquals(SessionEventDto.STOPPED, sessionEvents.get(1).type());
        assertEquals(SessionState.STOPPED.name(), sessionEvents.get(1).session().getState());
    }

    @Test
    void unknownSessionIsNotFound() {
        assertThrows(NotFoundException.class, () -> service.stopAssociationUseCase("nope"));
        assertThrows(NotFoundException.class, () -> service.getSessionUseCase("nope"));
    }

    @Test
    void dissociateValidatesAndReportsUnknownTags() {
        assertThrows(ValidationException.class, () -> service.dissociateUseCase("xyz"));
        assertThrows(NotFoundException.class, () -> service.dissociateUseCase("abcd1234"));

        tagRepository.givenTagBoundTo("abcd1234", "p1");
        assertTrue(service.dissociateUseCase("AB:CD:12:34"));
        assertNull(tagRepository.get("abcd1234").getAssociatedPlaylistId());

        assertEquals(List.of(new TagDissociatedEvent("abcd1234", "p1")), dissociations);
    }

    @Test
    void readerThreadIsNotBlockedBySlowTagWrites() throws Exception {
        BlockingTagRepository slowRepository = new BlockingTagRepository();
        AssociationService slowAssociations = new AssociationService(slowRepository, Optional.empty(), clock, 60);
        MockNfcReaderAdapter slowReader = new MockNfcReaderAdapter();
        NfcApplicationService slowService = new NfcApplicationService(slowReader, slowAssociations,
                new NfcEventDispatcher(), slowRepository, detectionExecutor, sweepScheduler, 30);
        List<String> playback = new CopyOnWriteArrayList<>();
        slowService.registerTagDetectedCallback(playback::add);
        slowService.startSystem();
        slowService.startAssociationUseCase("p1", 60, false);

        slowReader.simulateTagDetection("04f7eda4df6181");
        assertTrue(slowRepository.awaitSaveStarted());

        // el worker está dentro de save(): el hilo del lector tiene que seguir libre
        assertTimeoutPreemptively(Duration.ofSeconds(2), () -> {
            assertTrue(slowReader.simulateTagDetection("abcd1234"));
            assertEquals(1, slowAssociations.getActiveSessions().size());
        });

        slowRepository.release();
        drainDetections();

        assertTrue(playback.isEmpty());
        assertEquals("p1", slowRepository.get("04f7eda4df6181").getAssociatedPlaylistId());
    }

    @Test
    void claimedSessionCannotBeStopped() throws Exception {
        BlockingTagRepository slowRepository = new BlockingTagRepository();
        AssociationService slowAssociations = new AssociationService(slowRepository, Optional.empty(), clock, 60);
        MockNfcReaderAdapter slowReader = new MockNfcReaderAdapter();
        NfcApplicationService slowService = new NfcApplicationService(slowReader, slowAssociations,
                new NfcEventDispatcher(), slowRepository, detectionExecutor, sweepScheduler, 30);
        slowService.startSystem();
        AssociationSessionDto session = slowService.startAssociationUseCase("p1", 60, false);

        slowReader.simulateTagDetection("04f7eda4df6181");
        assertTrue(slowRepository.awaitSaveStarted());

        assertFalse(slowService.stopAssociationUseCase(session.getSessionId()));
        AssociationSessionDto current = slowService.getSessionUseCase(session.getSessionId());
        assertTrue(current.isClaimed());
        assertEquals(SessionState.LISTENING.name(), current.getState());
        assertEquals("04f7eda4df6181", current.getDetectedTag());

        slowRepository.release();
        drainDetections();

        assertEquals(SessionState.SUCCESS.name(), slowService.getSessionUseCase(session.getSessionId()).getState());
    }

    @Test
    void sweepPublishesTimedOutSessions() throws Exception {
        NfcApplicationService sweeping = new NfcApplicationService(new MockNfcReaderAdapter(), associationService,
                new NfcEventDispatcher(), tagRepository, detectionExecutor, sweepScheduler, 1);
        CountDownLatch timedOut = new CountDownLatch(1);
        List<SessionEventDto> events = new CopyOnWriteArrayList<>();
        sweeping.registerSessionCallback(event -> {
            events.add(event);
            if (SessionEventDto.TIMEOUT.equals(event.type())) {
                timedOut.countDown();
            }
        });

        AssociationSessionDto session = sweeping.startAssociationUseCase("p1", 30, false);
        sweeping.startSystem();
        clock.advance(Duration.ofSeconds(31));

        assertTrue(timedOut.await(5, TimeUnit.SECONDS));
        SessionEventDto timeout = events.get(events.size() - 1);
        assertEquals(session.getSessionId(), timeout.session().getSessionId());
        assertEquals(SessionState.TIMEOUT.name(), timeout.session().getState());
        assertTrue(associationService.getActiveSessions().isEmpty());

        sweeping.stopSystem();
    }

    @Test
    void startAndStopControlReaderAndSweep() {
        NfcStatusDto status = service.startSystem();

        assertTrue(status.isDetecting());
        assertTrue(status.isSweepRunning());
        assertEquals("mock", status.getHardware().get("adapterType"));

        service.stopSystem();

        assertFalse(reader.isDetecting());
        assertFalse(service.isSweepRunning());
    }

    @Test
    void statusListsActiveSessions() {
        service.startAssociationUseCase("p1", 60, false);

        NfcStatusDto status = service.getStatusUseCase();

        assertEquals(1, status.getSessionCount());
        assertEquals("p1", status.getActiveSessions().get(0).getPlaylistId());
    }

    @Test
    void hardwareFailureOnStartIsWrapped() {
        NfcHardwareAdapter broken = mock(NfcHardwareAdapter.class);
        doThrow(new IllegalStateException("usb")).when(broken).startDetection();
        NfcApplicationService brokenService = new NfcApplicationService(broken, associationService,
                new NfcEventDispatcher(), tagRepository, detectionExecutor, sweepScheduler, 30);

        HardwareException e = assertThrows(HardwareException.class, brokenService::startSystem);

        assertTrue(e.getMessage().contains("usb"));
        assertFalse(brokenService.isSweepRunning());
    }

    @Test
    void shutdownCancelsListeningSessions() {
        service.startSystem();
        AssociationSessionDto session = service.startAssociationUseCase("p1", 60, false);

        service.shutdown();

        assertEquals(SessionState.CANCELLED.name(), service.getSessionUseCase(session.getSessionId()).getState());
        assertEquals(SessionEventDto.CANCELLED, sessionEvents.get(sessionEvents.size() - 1).type());
        assertFalse(reader.isDetecting());
        assertFalse(service.isSweepRunning());
    }

    private void drainDetections() throws Exception {
        // el worker es de un solo hilo: cuando esta tarea termina, las anteriores también
        detectionExecutor.submit(() -> {
        }).get(5, TimeUnit.SECONDS);
    }
}

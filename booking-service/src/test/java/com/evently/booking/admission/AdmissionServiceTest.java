package com.evently.booking.admission;

import com.evently.booking.queue.DeferredAdmissionJob;
import com.evently.booking.queue.DeferredAdmissionQueue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AdmissionServiceTest {

    private static final String CLIENT = "client-1";

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOps;

    @Mock
    private DeferredAdmissionQueue admissionQueue;

    private AdmissionProperties properties;

    private AdmissionService admissionService;

    @BeforeEach
    void setUp() {
        properties = new AdmissionProperties();
        admissionService = new AdmissionService(redisTemplate, admissionQueue, properties);
    }

    @Test
    void evaluate_FirstRequestForShow_AdmittedAndStartsWindow() {
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        when(valueOps.get("waiting_room:" + CLIENT)).thenReturn(null);
        when(valueOps.get("show_demand:5")).thenReturn(null);
        when(valueOps.increment("show_demand:5")).thenReturn(1L);

        AdmissionDecision decision = admissionService.evaluate(CLIENT, 5L);

        assertTrue(decision.isAdmitted());
        verify(redisTemplate).expire("show_demand:5", Duration.ofSeconds(300));
        verifyNoInteractions(admissionQueue);
    }

    @Test
    void evaluate_CounterAtThreshold_StillAdmitted() {
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        when(valueOps.get("waiting_room:" + CLIENT)).thenReturn(null);
        when(valueOps.get("show_demand:5")).thenReturn("50");
        when(valueOps.increment("show_demand:5")).thenReturn(51L);

        assertTrue(admissionService.evaluate(CLIENT, 5L).isAdmitted());
        verify(redisTemplate, never()).expire(anyString(), any(Duration.class));
    }

    @Test
    void evaluate_ShowAboveThreshold_QueuesClientAndDefers() {
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        when(valueOps.get("waiting_room:" + CLIENT)).thenReturn(null);
        when(valueOps.get("show_demand:5")).thenReturn("51");

        AdmissionDecision decision = admissionService.evaluate(CLIENT, 5L);

        assertFalse(decision.isAdmitted());
        assertTrue(decision.getQueueToken().startsWith("QUEUE_"));
        assertTrue(decision.getEstimatedWaitSeconds() >= 5);

        ArgumentCaptor<DeferredAdmissionJob> jobCaptor = ArgumentCaptor.forClass(DeferredAdmissionJob.class);
        ArgumentCaptor<Duration> delayCaptor = ArgumentCaptor.forClass(Duration.class);
        verify(admissionQueue).enqueue(jobCaptor.capture(), delayCaptor.capture());
        DeferredAdmissionJob job = jobCaptor.getValue();
        assertEquals(CLIENT, job.getClientId());
        assertEquals(5L, job.getShowId());
        assertEquals(1, job.getAttempt());
        assertEquals(decision.getQueueToken(), job.getToken());
        assertTrue(job.getPriority() >= 0 && job.getPriority() < 10);
        long delayMs = delayCaptor.getValue().toMillis();
        assertTrue(delayMs >= 5000 && delayMs <= 20000);

        verify(valueOps).set("waiting_room:" + CLIENT, decision.getQueueToken(), Duration.ofSeconds(300));
        verify(valueOps, never()).increment(anyString());
    }

    @Test
    void evaluate_NoShow_UsesSystemCounter() {
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        when(valueOps.get("waiting_room:" + CLIENT)).thenReturn(null);
        when(valueOps.get(AdmissionService.SYSTEM_LOAD_KEY)).thenReturn(null);
        when(valueOps.increment(AdmissionService.SYSTEM_LOAD_KEY)).thenReturn(1L);

        assertTrue(admissionService.evaluate(CLIENT, null).isAdmitted());
        verify(redisTemplate).expire(AdmissionService.SYSTEM_LOAD_KEY, Duration.ofSeconds(120));
    }

    @Test
    void evaluate_SystemAboveThreshold_Defers() {
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        when(valueOps.get("waiting_room:" + CLIENT)).thenReturn(null);
        when(valueOps.get(AdmissionService.SYSTEM_LOAD_KEY)).thenReturn("201");

        assertFalse(admissionService.evaluate(CLIENT, null).isAdmitted());
        verify(admissionQueue).enqueue(any(DeferredAdmissionJob.class), any(Duration.class));
    }

    @Test
    void evaluate_WaitingClientPromoted_ConsumesTokenAndAdmits() {
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        when(valueOps.get("waiting_room:" + CLIENT)).thenReturn("QUEUE_abc");
        when(valueOps.get("can_proceed:QUEUE_abc")).thenReturn("true");

        assertTrue(admissionService.evaluate(CLIENT, 5L).isAdmitted());

        verify(redisTemplate).delete("can_proceed:QUEUE_abc");
        verify(redisTemplate).delete("waiting_room:" + CLIENT);
        verify(valueOps, never()).increment(anyString());
    }

    @Test
    void evaluate_WaitingClientNotYetPromoted_DeferredWithSameToken() {
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        when(valueOps.get("waiting_room:" + CLIENT)).thenReturn("QUEUE_abc");
        when(valueOps.get("can_proceed:QUEUE_abc")).thenReturn(null);

        AdmissionDecision decision = admissionService.evaluate(CLIENT, 5L);

        assertFalse(decision.isAdmitted());
        assertEquals("QUEUE_abc", decision.getQueueToken());
        verify(admissionQueue, never()).enqueue(any(), any());
    }

    @Test
    void evaluate_RedisDown_FailsOpen() {
        when(redisTemplate.opsForValue()).thenThrow(new RedisConnectionFailureException("Redis down"));

        assertTrue(admissionService.evaluate(CLIENT, 5L).isAdmitted());
    }

    @Test
    void estimateWaitSeconds_AccountsForQueueDepth() {
        when(admissionQueue.size()).thenReturn(20L);

        // 5 s delay + 2 batches of 3.5 s + own 3.5 s
        assertEquals(16L, admissionService.estimateWaitSeconds(5000));
    }

    @Test
    void estimateWaitSeconds_QueueUnreadable_TreatsAsEmpty() {
        when(admissionQueue.size()).thenThrow(new RedisConnectionFailureException("Redis down"));

        assertEquals(4L, admissionService.estimateWaitSeconds(0));
    }
}

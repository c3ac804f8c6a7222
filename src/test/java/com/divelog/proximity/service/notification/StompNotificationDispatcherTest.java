package com.divelog.proximity.service.notification;

import com.divelog.proximity.dto.DiveReminderRecord;
import com.divelog.proximity.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.scheduling.TaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ScheduledFuture;

import static com.divelog.proximity.support.TestSites.T0;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

class StompNotificationDispatcherTest {

    private TaskScheduler taskScheduler;
    private SimpMessagingTemplate messagingTemplate;
    private ScheduledFuture<?> firstFuture;
    private ScheduledFuture<?> secondFuture;
    private StompNotificationDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        taskScheduler = mock(TaskScheduler.class);
        messagingTemplate = mock(SimpMessagingTemplate.class);
        firstFuture = mock(ScheduledFuture.class);
        secondFuture = mock(ScheduledFuture.class);
        doReturn(firstFuture, secondFuture).when(taskScheduler).schedule(any(Runnable.class), any(Instant.class));
        dispatcher = new StompNotificationDispatcher(taskScheduler, messagingTemplate, new MutableClock(T0));
    }

    @Test
    void shouldScheduleDelayedReminderRelativeToNow() {
        dispatcher.scheduleDelayed("blue-hole", Duration.ofMinutes(15));

        verify(taskScheduler).schedule(any(Runnable.class), eq(T0.plus(Duration.ofMinutes(15))));
        assertThat(dispatcher.hasPending("blue-hole")).isTrue();
    }

    @Test
    void shouldReplacePendingReminderForSameSite() {
        dispatcher.scheduleDelayed("blue-hole", Duration.ofMinutes(15));
        dispatcher.scheduleImmediate("blue-hole");

        verify(firstFuture).cancel(false);
        verify(secondFuture, never()).cancel(false);
        assertThat(dispatcher.hasPending("blue-hole")).isTrue();
    }

    @Test
    void shouldCancelPendingReminder() {
        dispatcher.scheduleDelayed("blue-hole", Duration.ofMinutes(15));

        assertThat(dispatcher.cancel("blue-hole")).isTrue();
        assertThat(dispatcher.cancel("blue-hole")).isFalse();
        verify(firstFuture).cancel(false);
        assertThat(dispatcher.hasPending("blue-hole")).isFalse();
    }

    @Test
    void shouldDeliverPromptWithActionsWhenFired() {
        ArgumentCaptor<Runnable> task = ArgumentCaptor.forClass(Runnable.class);
        dispatcher.scheduleImmediate("canyon");
        verify(taskScheduler).schedule(task.capture(), eq(T0));

        task.getValue().run();

        ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);
        verify(messagingTemplate).convertAndSend(eq(StompNotificationDispatcher.REMINDER_TOPIC), payload.capture());
        assertThat(payload.getValue()).isEqualTo(new DiveReminderRecord(
            "canyon",
            ReminderCategory.DIVE_LOG_PROMPT,
            List.of(ReminderCategory.ACTION_LOG_DIVE, ReminderCategory.ACTION_DISMISS),
            T0
        ));
        assertThat(dispatcher.hasPending("canyon")).isFalse();
    }

    @Test
    void shouldNotClearNewerReminderWhenOlderOneFires() {
        ArgumentCaptor<Runnable> tasks = ArgumentCaptor.forClass(Runnable.class);
        dispatcher.scheduleDelayed("canyon", Duration.ofMinutes(15));
        dispatcher.scheduleDelayed("canyon", Duration.ofMinutes(15));
        verify(taskScheduler, times(2)).schedule(tasks.capture(), any(Instant.class));

        tasks.getAllValues().get(0).run();

        assertThat(dispatcher.hasPending("canyon")).isTrue();
    }

    @Test
    void shouldNotReportImmediatePromptAsPendingOnceDelivered() {
        ScheduledFuture<?> completed = mock(ScheduledFuture.class);
        doAnswer(invocation -> {
            invocation.<Runnable>getArgument(0).run();
            return completed;
        }).when(taskScheduler).schedule(any(Runnable.class), any(Instant.class));

        dispatcher.scheduleImmediate("canyon");

        verify(messagingTemplate).convertAndSend(eq(StompNotificationDispatcher.REMINDER_TOPIC), any(Object.class));
        assertThat(dispatcher.hasPending("canyon")).isFalse();
        assertThat(dispatcher.cancel("canyon")).isFalse();
        verify(completed, never()).cancel(false);
    }

    @Test
    void shouldNotDeliverReplacedReminderThatFiresLate() {
        ArgumentCaptor<Runnable> tasks = ArgumentCaptor.forClass(Runnable.class);
        dispatcher.scheduleDelayed("canyon", Duration.ofMinutes(15));
        dispatcher.scheduleImmediate("canyon");
        verify(taskScheduler, times(2)).schedule(tasks.capture(), any(Instant.class));

        tasks.getAllValues().get(0).run();

        verify(messagingTemplate, never()).convertAndSend(any(String.class), any(Object.class));
    }

    @Test
    void shouldNotKeepReminderWhenSchedulingIsRejected() {
        doAnswer(invocation -> {
            throw new TaskRejectedException("scheduler shut down");
        }).when(taskScheduler).schedule(any(Runnable.class), any(Instant.class));

        assertThatThrownBy(() -> dispatcher.scheduleImmediate("canyon"))
            .isInstanceOf(TaskRejectedException.class);
        assertThat(dispatcher.hasPending("canyon")).isFalse();
    }
}

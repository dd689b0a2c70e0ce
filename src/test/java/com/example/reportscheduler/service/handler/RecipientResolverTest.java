package com.example.reportscheduler.service.handler;

import com.example.reportscheduler.client.SubscriberDirectory;
import com.example.reportscheduler.domain.enums.JobType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Arrays;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("RecipientResolver Tests")
class RecipientResolverTest {

    @Mock
    private SubscriberDirectory subscriberDirectory;

    @InjectMocks
    private RecipientResolver recipientResolver;

    private JobContext.JobContextBuilder context() {
        return JobContext.builder().scheduleId(UUID.randomUUID()).jobType(JobType.TIP_REPORT).name("Weekly tips");
    }

    @Test
    @DisplayName("Should put explicit recipients before subscribers")
    void shouldMergeExplicitAndSubscribers() {
        when(subscriberDirectory.optedInRecipients(JobType.TIP_REPORT)).thenReturn(List.of("owner@example.com", "boss@example.com"));

        var recipients = recipientResolver.resolve(context().recipients(List.of("manager@example.com")).build());

        assertThat(recipients).containsExactly("manager@example.com", "owner@example.com", "boss@example.com");
    }

    @Test
    @DisplayName("Should drop blanks and case-insensitive duplicates")
    void shouldDropBlanksAndDuplicates() {
        when(subscriberDirectory.optedInRecipients(JobType.TIP_REPORT)).thenReturn(List.of("Manager@Example.com"));

        var recipients = recipientResolver.resolve(context()
                .recipients(Arrays.asList(" manager@example.com ", "", null, "MANAGER@example.com"))
                .build());

        assertThat(recipients).containsExactly("manager@example.com");
    }

    @Test
    @DisplayName("Should skip subscribers when opt-in is bypassed")
    void shouldSkipSubscribersOnBypass() {
        var recipients = recipientResolver.resolve(context()
                .recipients(List.of("only@example.com"))
                .bypassOptIn(true)
                .build());

        assertThat(recipients).containsExactly("only@example.com");
        verifyNoInteractions(subscriberDirectory);
    }

    @Test
    @DisplayName("Should return an empty list when nobody is subscribed")
    void shouldReturnEmptyList() {
        when(subscriberDirectory.optedInRecipients(JobType.TIP_REPORT)).thenReturn(List.of());

        assertThat(recipientResolver.resolve(context().build())).isEmpty();
    }
}

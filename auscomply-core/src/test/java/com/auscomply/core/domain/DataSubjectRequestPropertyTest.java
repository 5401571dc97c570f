package com.auscomply.core.domain;

import com.auscomply.core.domain.DataSubjectRequest.RequestStatus;
import com.auscomply.core.domain.DataSubjectRequest.RequestType;
import net.jqwik.api.*;
import net.jqwik.api.constraints.LongRange;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

/**
 * Property tests for data-subject request deadlines and status transitions.
 */
class DataSubjectRequestPropertyTest {

    @Property
    void dueDateIsThirtyDaysAfterRequest(@ForAll @LongRange(min = 0, max = 4_000_000_000L) long epochSecond,
                                         @ForAll RequestType type) {
        Instant requestDate = Instant.ofEpochSecond(epochSecond);
        DataSubjectRequest request = DataSubjectRequest.create("user-1", type, null, "email", requestDate);

        assertThat(request.getDueDate()).isEqualTo(requestDate.plus(Duration.ofDays(30)));
        assertThat(request.getStatus()).isEqualTo(RequestStatus.PENDING);
        assertThat(request.getDetails().getKind()).isEqualTo(RequestDetails.Kind.forRequestType(type));
    }

    @Property
    void pendingRequestIsOverdueOnlyAfterDueDate(@ForAll @LongRange(min = 0, max = 60 * 24) long hoursLater) {
        Instant requestDate = Instant.parse("2025-01-01T00:00:00Z");
        DataSubjectRequest request = DataSubjectRequest.create("user-1", RequestType.ACCESS, null, "email", requestDate);

        Instant now = requestDate.plus(Duration.ofHours(hoursLater));
        assertThat(request.isOverdueAt(now)).isEqualTo(now.isAfter(request.getDueDate()));
    }

    @Property
    void transitionsNeverLeaveATerminalStatus(@ForAll RequestStatus from, @ForAll RequestStatus to) {
        if (from.isTerminal()) {
            assertThat(from.canTransitionTo(to)).isFalse();
        }
    }

    @Property
    void transitionsOnlyMoveForward(@ForAll RequestStatus from, @ForAll RequestStatus to) {
        if (from.canTransitionTo(to)) {
            assertThat(to.ordinal()).isGreaterThan(from.ordinal());
        }
    }

    @Example
    void pendingMayBeRejectedDirectly() {
        assertThat(RequestStatus.PENDING.allowedTransitions())
                .containsExactlyInAnyOrder(RequestStatus.PROCESSING, RequestStatus.REJECTED);
        assertThat(RequestStatus.PENDING.canTransitionTo(RequestStatus.COMPLETED)).isFalse();
    }
}

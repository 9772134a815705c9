package com.bookati.reservation.domain.strategy;

import com.bookati.reservation.domain.exception.CapacityExhaustedException;
import com.bookati.reservation.domain.model.Slot;
import com.bookati.reservation.domain.repository.SlotRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class PessimisticLockReservationStrategyTest {

    @Mock
    private SlotRepository repository;

    @InjectMocks
    private PessimisticLockReservationStrategy strategy;

    @Test
    @DisplayName("reserve() moves capacity from available to booked on the locked row")
    void reserve_success() {
        Slot slot = slot(4);
        given(repository.findByIdForUpdate(slot.getId())).willReturn(Optional.of(slot));

        strategy.reserve(slot.getId(), 3, 1);

        assertThat(slot.getAvailableCapacity()).isEqualTo(1);
        assertThat(slot.getBookedCount()).isEqualTo(7);
        verify(repository).save(slot);
    }

    @Test
    @DisplayName("reserve() leaves capacity held by other sessions untouched")
    void reserve_respectsHeldElsewhere() {
        Slot slot = slot(4);
        given(repository.findByIdForUpdate(slot.getId())).willReturn(Optional.of(slot));

        assertThatThrownBy(() -> strategy.reserve(slot.getId(), 3, 2))
                .isInstanceOf(CapacityExhaustedException.class);
        assertThat(slot.getAvailableCapacity()).isEqualTo(4);
        verify(repository, never()).save(any());
    }

    private Slot slot(int available) {
        return Slot.builder()
                .id(UUID.randomUUID())
                .tenantId(UUID.randomUUID())
                .serviceId(UUID.randomUUID())
                .slotDate(LocalDate.of(2026, 4, 1))
                .startTime(LocalTime.of(9, 0))
                .endTime(LocalTime.of(10, 0))
                .originalCapacity(8)
                .availableCapacity(available)
                .bookedCount(8 - available)
                .available(true)
                .build();
    }
}

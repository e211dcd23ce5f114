package com.appointments.booking.dto;

import lombok.*;
import lombok.experimental.FieldDefaults;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
public class AvailabilityResponse {

    List<DayAvailability> dates;
    List<String> timeSlots;
    String minDate;
    String maxDate;
}

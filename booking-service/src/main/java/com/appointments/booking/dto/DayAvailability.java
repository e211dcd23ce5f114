package com.appointments.booking.dto;

import java.util.List;

public record DayAvailability(String date, String label, List<String> available) {
}

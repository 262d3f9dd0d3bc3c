package io.pricelake.financial.model;

import java.time.LocalDate;

public record RowKey(String instrument, LocalDate date) {}

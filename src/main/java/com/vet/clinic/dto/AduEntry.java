package com.vet.clinic.dto;

public record AduEntry(Long itemId, String itemName, String category, double averageDailyUse,
                       int currentStock, StockStatus status) {}

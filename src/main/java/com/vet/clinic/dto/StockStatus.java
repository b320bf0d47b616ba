package com.vet.clinic.dto;

public enum StockStatus { REORDER_NOW, MONITOR, SAFE }

package com.vet.clinic.dto;

public enum DeductionDecision { CONFIRM, REJECT }

package com.Excel.Variance.model;

public enum ModelSide {
    OLD,
    NEW
}

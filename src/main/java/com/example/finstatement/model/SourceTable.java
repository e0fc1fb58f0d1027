package com.example.finstatement.model;

import java.util.ArrayList;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One decoded worksheet: rows of cells, first cell the label, rightmost the latest period.
 * Cells are {@link Number}, {@link String} or null.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SourceTable {
    private String name;
    private List<List<Object>> rows = new ArrayList<>();
}

package com.example.finstatement.model;

import java.util.ArrayList;
import java.util.List;

import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class NoteSection {
    private int number;
    private String heading;
    private List<String> content = new ArrayList<>();

    public NoteSection(int number, String heading) {
        this.number = number;
        this.heading = heading;
    }
}

package com.example.finstatement.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A director or the compilation signatory. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class Signatory {
    private String name;
    private String title;
}

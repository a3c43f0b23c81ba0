package com.example.snapshotcompare.web;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
public class RenameComparisonRequest {
    private String name;
}

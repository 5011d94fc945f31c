package com.legalgraph.dto.graph;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"id", "cited_by", "cited_by_count"})
public class ReverseIndexEntry {

    private String id;

    @Builder.Default
    private List<String> citedBy = new ArrayList<>();

    private int citedByCount;
}

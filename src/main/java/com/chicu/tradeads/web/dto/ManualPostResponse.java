package com.chicu.tradeads.web.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ManualPostResponse {
    private boolean success;
    private List<String> logs;
}

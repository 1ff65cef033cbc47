package com.xbleey.signalalert.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.Map;

@Getter
@Setter
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class GoPlusResponse {

    public static final int CODE_OK = 1;

    private Integer code;
    private String message;
    private Map<String, GoPlusTokenSecurity> result;
}

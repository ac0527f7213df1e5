package com.eyelevel.docpipeline.common.apiclient.model;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

/**
 * Static headers sent with every request of a client.
 */
@Data
@AllArgsConstructor
public class HeaderConfig {

    private List<Header> headers;

    @Data
    @AllArgsConstructor
    public static class Header {
        private String name;
        private String value;
    }
}

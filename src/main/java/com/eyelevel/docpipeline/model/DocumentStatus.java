package com.eyelevel.docpipeline.model;

public enum DocumentStatus {
    UPLOADED, PROCESSING, READY, ERROR, DELETED
}

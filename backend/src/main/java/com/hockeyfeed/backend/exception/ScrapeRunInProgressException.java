package com.hockeyfeed.backend.exception;

public class ScrapeRunInProgressException extends RuntimeException {

    public ScrapeRunInProgressException() {
        super("A scrape run is already in progress");
    }
}

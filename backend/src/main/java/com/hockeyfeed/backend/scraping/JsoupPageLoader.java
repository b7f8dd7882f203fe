package com.hockeyfeed.backend.scraping;

import com.hockeyfeed.backend.config.ScrapingConfig;
import java.io.IOException;
import java.io.UncheckedIOException;
import lombok.RequiredArgsConstructor;
import org.jsoup.Connection;
import org.jsoup.Jsoup;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class JsoupPageLoader implements PageLoader {

    private final ScrapingConfig scrapingConfig;

    @Override
    public PageResponse load(String url) throws IOException {
        Connection.Response response = Jsoup.connect(url)
                .userAgent(scrapingConfig.getUserAgent())
                .headers(scrapingConfig.getDefaultHeaders())
                .timeout((int) scrapingConfig.getTimeout().toMillis())
                .followRedirects(true)
                // status codes are handled by the retry loop, robots.txt is text/plain
                .ignoreHttpErrors(true)
                .ignoreContentType(true)
                .maxBodySize(0)
                .execute();
        try {
            // the body is read lazily; a timeout while reading it surfaces unchecked
            return new PageResponse(response.statusCode(), response.body());
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }
}

package com.hockeyfeed.backend.scraping;

import crawlercommons.robots.BaseRobotRules;

/**
 * Answers whether a URL may be fetched, for one run.
 */
public class RobotsPolicy {

    // null when the site publishes no robots.txt
    private final BaseRobotRules rules;

    RobotsPolicy(BaseRobotRules rules) {
        this.rules = rules;
    }

    public static RobotsPolicy allowAll() {
        return new RobotsPolicy(null);
    }

    public boolean allows(String url) {
        return rules == null || rules.isAllowed(url);
    }
}

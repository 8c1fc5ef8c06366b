package com.mender.review;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "mender.review")
public class ReviewProperties {

    /** "log" or "git". */
    private String provider = "log";

    /** Remote that review branches are pushed to. */
    private String remote = "origin";

    private boolean push = true;

    private String authorName = "Mender";
    private String authorEmail = "mender@mender.local";

    public String getProvider() { return provider; }
    public void setProvider(String provider) { this.provider = provider; }
    public String getRemote() { return remote; }
    public void setRemote(String remote) { this.remote = remote; }
    public boolean isPush() { return push; }
    public void setPush(boolean push) { this.push = push; }
    public String getAuthorName() { return authorName; }
    public void setAuthorName(String authorName) { this.authorName = authorName; }
    public String getAuthorEmail() { return authorEmail; }
    public void setAuthorEmail(String authorEmail) { this.authorEmail = authorEmail; }
}

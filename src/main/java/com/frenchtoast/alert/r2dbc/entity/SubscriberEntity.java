package com.frenchtoast.alert.r2dbc.entity;

import java.time.OffsetDateTime;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

@Table("ft_subscriber")
public class SubscriberEntity {

    @Id
    private Long id;

    @Column("team_id")
    private String teamId;

    @Column("channel_id")
    private String channelId;

    @Column("encrypted_url")
    private String encryptedUrl;

    @Column("added")
    private OffsetDateTime added;

    @Column("last_notified")
    private OffsetDateTime lastNotified;

    @Column("inactive")
    private Boolean inactive;

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public String getTeamId() { return teamId; }
    public void setTeamId(String teamId) { this.teamId = teamId; }

    public String getChannelId() { return channelId; }
    public void setChannelId(String channelId) { this.channelId = channelId; }

    public String getEncryptedUrl() { return encryptedUrl; }
    public void setEncryptedUrl(String encryptedUrl) { this.encryptedUrl = encryptedUrl; }

    public OffsetDateTime getAdded() { return added; }
    public void setAdded(OffsetDateTime added) { this.added = added; }

    public OffsetDateTime getLastNotified() { return lastNotified; }
    public void setLastNotified(OffsetDateTime lastNotified) { this.lastNotified = lastNotified; }

    public Boolean getInactive() { return inactive; }
    public void setInactive(Boolean inactive) { this.inactive = inactive; }
}

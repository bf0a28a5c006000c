package com.example.interviewreminder.domain.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * Read-only view of a platform user, as needed to address a reminder.
 */
@Entity
@Table(name = "users")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class UserAccount {

    @Id
    @Column(name = "id", length = 100)
    private String id;

    @Column(name = "full_name", length = 200)
    private String fullName;

    @Column(name = "nickname", length = 100)
    private String nickname;

    @Column(name = "email", nullable = false, length = 320)
    private String email;

    /**
     * BCP 47 language tag, e.g. ja-JP (optional)
     */
    @Column(name = "locale", length = 35)
    private String locale;

    /**
     * IANA zone id, e.g. Asia/Tokyo (optional)
     */
    @Column(name = "time_zone", length = 64)
    private String timeZone;

    /**
     * Full name when present, nickname otherwise
     */
    public String getDisplayName() {
        return fullName != null && !fullName.isBlank() ? fullName : nickname;
    }
}

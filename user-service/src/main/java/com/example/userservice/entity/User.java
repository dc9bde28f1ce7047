package com.example.userservice.entity;

import jakarta.persistence.*;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * User entity mapping to 'users' table.
 *
 * Role specialisation (TA, instructor, administrator...) is not modelled with
 * subtypes: callers dispatch on {@link Role#getKind()}.
 *
 * Role, institution and parent are fetched eagerly so that users handed out by
 * the directory stay usable for authorization and mapping once detached.
 *
 * Preference flags default to false except etcIconsOnHomepage, and newUser is
 * set on every freshly constructed instance.
 */
@Entity
@Table(name = "users", indexes = {
    @Index(name = "idx_users_email", columnList = "email"),
    @Index(name = "idx_users_full_name", columnList = "full_name"),
    @Index(name = "idx_users_parent", columnList = "parent_id")
})
@Getter
@Setter
@NoArgsConstructor
public class User {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false)
    private Long id;

    @NotBlank
    @Pattern(regexp = "^[a-z]+$", message = "must be in lowercase")
    @Column(name = "name", nullable = false, unique = true, length = 100)
    private String name;

    @NotBlank
    @Size(max = 50)
    @Column(name = "full_name", nullable = false, length = 50)
    private String fullName;

    @NotBlank
    @Email
    @Column(name = "email", nullable = false, length = 255)
    private String email;

    @Column(name = "password_digest", nullable = false, length = 255)
    private String passwordDigest;

    @NotNull
    @ManyToOne(fetch = FetchType.EAGER, optional = false)
    @JoinColumn(name = "role_id", nullable = false)
    private Role role;

    @ManyToOne(fetch = FetchType.EAGER)
    @JoinColumn(name = "institution_id")
    private Institution institution;

    @ManyToOne(fetch = FetchType.EAGER)
    @JoinColumn(name = "parent_id")
    private User parent;

    /**
     * Sub-accounts. Not cascaded: children are detached when the parent goes away.
     */
    @OneToMany(mappedBy = "parent")
    private List<User> children = new ArrayList<>();

    @Column(name = "copy_of_emails", nullable = false)
    private boolean copyOfEmails = false;

    @Column(name = "email_on_review", nullable = false)
    private boolean emailOnReview = false;

    @Column(name = "email_on_submission", nullable = false)
    private boolean emailOnSubmission = false;

    @Column(name = "email_on_review_of_review", nullable = false)
    private boolean emailOnReviewOfReview = false;

    @Column(name = "etc_icons_on_homepage", nullable = false)
    private boolean etcIconsOnHomepage = true;

    @Column(name = "is_new_user", nullable = false)
    private boolean newUser = true;

    public boolean isStudent() {
        return role.isStudent();
    }

    public boolean isTeachingAssistant() {
        return role.isTeachingAssistant();
    }

    public boolean isInstructor() {
        return role.isInstructor();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof User other)) {
            return false;
        }
        return id != null && id.equals(other.getId());
    }

    @Override
    public int hashCode() {
        return User.class.hashCode();
    }

    @Override
    public String toString() {
        return "User{id=" + id + ", name='" + name + "'}";
    }
}

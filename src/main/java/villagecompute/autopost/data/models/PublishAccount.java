package villagecompute.autopost.data.models;

import java.time.Instant;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * A platform account that notes are published under.
 *
 * <p>
 * {@code cookie} holds the full browser session cookie string; it is the only credential the platform accepts and
 * feeds both request signing and the {@code Cookie} header.
 */
@Entity
@Table(
        name = "publish_accounts")
public class PublishAccount extends PanacheEntityBase {

    @Id
    @Column(
            nullable = false)
    public String id;

    @Column(
            nullable = false)
    public String name;

    @Column(
            nullable = false)
    public String cookie;

    @Column(
            name = "platform_user_id")
    public String platformUserId;

    @Column
    public String nickname;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;
}

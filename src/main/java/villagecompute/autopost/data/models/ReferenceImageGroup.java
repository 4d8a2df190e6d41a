package villagecompute.autopost.data.models;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/**
 * A named set of reference images (product shots, a brand palette) with a short annotation. Posts may reference
 * groups to steer both copy and image generation.
 */
@Entity
@Table(
        name = "reference_image_groups")
public class ReferenceImageGroup extends PanacheEntityBase {

    @Id
    @GeneratedValue(
            strategy = GenerationType.IDENTITY)
    @Column(
            nullable = false)
    public Long id;

    @Column(
            nullable = false)
    public String name;

    @Column
    public String annotation;

    @Column(
            name = "image_urls",
            columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    public List<String> imageUrls = new ArrayList<>();

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    public static List<ReferenceImageGroup> findByIds(Collection<Long> ids) {
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        return list("id IN ?1 ORDER BY id", ids);
    }
}

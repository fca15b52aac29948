package vn.com.fecredit.resumableupload.model;

import jakarta.persistence.*;
import lombok.Data;

/**
 * Upload owner. Its username is the owner identity stored on every upload record.
 */
@Entity
@Table(name = "tenants")
@Data
public class TenantAccount {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String tenantId;

    @Column(nullable = false, unique = true)
    private String username;

    @Column(nullable = false)
    private String password; // {bcrypt} prefixed hash
}

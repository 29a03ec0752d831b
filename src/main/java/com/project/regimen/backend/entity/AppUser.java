package com.project.regimen.backend.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import jakarta.persistence.*;
import lombok.*;

import java.util.UUID;

@Getter
@Setter
@Entity
@Table(name = "app_users")
@AllArgsConstructor
@Builder
@NoArgsConstructor
public class AppUser {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    Integer uid;

    @Column(name = "firstname")
    String firstName;

    @Column(name = "lastname")
    String lastName;

    @Column(name = "username", unique = true)
    String username;

    @Column(name = "email")
    String email;

    @JsonIgnore
    @Column(name = "password")
    String password;

    // hour (0-23) at which a new program day starts
    @Column(name = "day_boundary_hour")
    int dayBoundaryHour;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(name = "execution_mode")
    ExecutionMode executionMode = ExecutionMode.SINGLE;

    // plan used in SINGLE mode
    @Column(name = "active_plan_id")
    UUID activePlanId;
}

package org.posts.model;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "posts")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Post {

    // Attribué par la base à l'insertion, jamais modifié ensuite
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Setter(AccessLevel.NONE)
    private Long id;

    // varchar sans longueur : aucune borne (H2, PostgreSQL), LIKE reste utilisable
    @Column(nullable = false, columnDefinition = "VARCHAR")
    private String title;

    @Column(nullable = false, columnDefinition = "VARCHAR")
    private String body;
}

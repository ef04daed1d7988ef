package org.nowstart.folio.data.entity;

import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Entity
@Getter
@Setter
@Builder
@AllArgsConstructor
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Security extends AuditableEntity {

    @Id
    private String ticker;

    private String name;

    // Securities sharing a group are treated as substantially identical for wash sales.
    private String substituteGroup;
}

package com.bsl.bankcode.query;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Structured hints pulled out of one query. Lives for a single retrieval call.
 */
public final class QueryEntities {
    private static final QueryEntities EMPTY = builder().build();

    private final String fullName;
    private final String bankType;
    private final String brand;
    private final String location;
    private final String branchName;
    private final String codePattern;
    private final List<String> keywords;

    private QueryEntities(Builder builder) {
        this.fullName = builder.fullName;
        this.bankType = builder.bankType;
        this.brand = builder.brand;
        this.location = builder.location;
        this.branchName = builder.branchName;
        this.codePattern = builder.codePattern;
        this.keywords = Collections.unmodifiableList(new ArrayList<>(builder.keywords));
    }

    public static QueryEntities empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<String> getFullName() {
        return Optional.ofNullable(fullName);
    }

    public Optional<String> getBankType() {
        return Optional.ofNullable(bankType);
    }

    public Optional<String> getBrand() {
        return Optional.ofNullable(brand);
    }

    public Optional<String> getLocation() {
        return Optional.ofNullable(location);
    }

    public Optional<String> getBranchName() {
        return Optional.ofNullable(branchName);
    }

    public Optional<String> getCodePattern() {
        return Optional.ofNullable(codePattern);
    }

    public List<String> getKeywords() {
        return keywords;
    }

    public boolean hasKeywords() {
        return !keywords.isEmpty();
    }

    @Override
    public String toString() {
        return "QueryEntities{fullName=" + fullName
            + ", bankType=" + bankType
            + ", brand=" + brand
            + ", location=" + location
            + ", branchName=" + branchName
            + ", codePattern=" + codePattern
            + ", keywords=" + keywords + "}";
    }

    public static final class Builder {
        private String fullName;
        private String bankType;
        private String brand;
        private String location;
        private String branchName;
        private String codePattern;
        private final Set<String> keywords = new LinkedHashSet<>();

        private Builder() {
        }

        public Builder fullName(String fullName) {
            this.fullName = fullName;
            return this;
        }

        public Builder bankType(String bankType) {
            this.bankType = bankType;
            return this;
        }

        public Builder brand(String brand) {
            this.brand = brand;
            return this;
        }

        public Builder location(String location) {
            this.location = location;
            return this;
        }

        public Builder branchName(String branchName) {
            this.branchName = branchName;
            return this;
        }

        public Builder codePattern(String codePattern) {
            this.codePattern = codePattern;
            return this;
        }

        public Builder keyword(String keyword) {
            if (keyword != null && !keyword.isBlank()) {
                keywords.add(keyword.trim());
            }
            return this;
        }

        boolean hasKeywords() {
            return !keywords.isEmpty();
        }

        String getBranchName() {
            return branchName;
        }

        String getLocation() {
            return location;
        }

        public QueryEntities build() {
            return new QueryEntities(this);
        }
    }
}

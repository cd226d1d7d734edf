package com.kmmedia.institute.payments.service.catalog;

import com.kmmedia.institute.payments.config.AppProperties;
import com.kmmedia.institute.payments.error.PaymentErrorCode;
import com.kmmedia.institute.payments.error.PaymentException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import org.springframework.stereotype.Component;

/**
 * Catalog backed by {@code app.catalog.courses.<courseId>} entries.
 */
@Component
public class ConfiguredCourseCatalog implements CourseCatalog {

    private final AppProperties properties;

    public ConfiguredCourseCatalog(AppProperties properties) {
        this.properties = properties;
    }

    @Override
    public CourseFeeTerms feeTerms(String courseId) {
        AppProperties.Course course = courseId == null ? null : properties.getCatalog().getCourses().get(courseId);
        if (course == null || course.getFee() == null) {
            throw PaymentException.of(PaymentErrorCode.NOT_FOUND, "Course " + courseId + " not found");
        }
        BigDecimal fee = course.getFee().setScale(2, RoundingMode.UNNECESSARY);
        return new CourseFeeTerms(courseId, fee, course.isInstallmentsOffered());
    }
}

package com.campus.payments.repository;

import com.campus.payments.entity.Student;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Student records owned by the profile service; this service only reads them and maintains the
 * payment fields.
 */
@Repository
public interface StudentRepository extends JpaRepository<Student, Long> {
}

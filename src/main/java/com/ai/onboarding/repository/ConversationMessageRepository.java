package com.ai.onboarding.repository;

import com.ai.onboarding.entity.ConversationMessage;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ConversationMessageRepository extends JpaRepository<ConversationMessage, Long> {
	List<ConversationMessage> findByUserIdOrderByCreatedAtAscIdAsc(Long userId);
}

package com.maildraft;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * MailDraft - turns short descriptions into complete, validated email drafts.
 */
@SpringBootApplication
public class MailDraftApplication {

	public static void main(String[] args) {
		SpringApplication.run(MailDraftApplication.class, args);
	}

}
